package com.creatorradar.api.dto;

import com.creatorradar.discovery.job.JobResultsPage;
import com.creatorradar.domain.CreatorEnrichment;
import com.creatorradar.domain.JobCreator;
import com.creatorradar.domain.NormalizedCreator;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * GET /api/v2/jobs/{jobId}/results. Creators in insertion order; {@code total} counts the whole job.
 */
public record JobResultsResponse(
        String jobId,
        String status,
        List<CreatorEntry> creators,
        int offset,
        int limit,
        long total
) {

    public record CreatorEntry(
            String identityKey,
            String keyword,
            String handle,
            String displayName,
            String profileUrl,
            String avatarUrl,
            Long followerCount,
            String bio,
            List<String> emails,
            boolean enriched,
            String enrichmentError,
            Instant enrichedAt
    ) {

        static CreatorEntry from(JobCreator jc) {
            NormalizedCreator c = jc.getCreator();
            CreatorEnrichment e = jc.getEnrichment();
            List<String> emails = e != null && !e.getEmails().isEmpty() ? e.getEmails()
                    : c != null ? c.getEmails() : List.of();
            return new CreatorEntry(
                    jc.getIdentityKey(),
                    jc.getKeyword(),
                    c != null ? c.getHandle() : null,
                    c != null ? c.getDisplayName() : null,
                    c != null ? c.getProfileUrl() : null,
                    c != null ? c.getAvatarUrl() : null,
                    c != null ? c.getFollowerCount() : null,
                    c != null ? c.getBio() : null,
                    List.copyOf(emails),
                    jc.isEnriched(),
                    e != null ? e.getError() : null,
                    e != null ? e.getFetchedAt() : null);
        }
    }

    public static JobResultsResponse from(JobResultsPage page) {
        return new JobResultsResponse(
                page.jobId(),
                page.status() != null ? page.status().name().toLowerCase(Locale.ROOT) : null,
                page.creators().stream().map(CreatorEntry::from).toList(),
                page.offset(),
                page.limit(),
                page.total());
    }
}
