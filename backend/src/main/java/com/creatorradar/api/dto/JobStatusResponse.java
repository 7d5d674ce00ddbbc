package com.creatorradar.api.dto;

import com.creatorradar.discovery.job.JobProgress;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * GET /api/v2/jobs/{jobId}/status. Status names are lowercase; error is omitted while the job is healthy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        String jobId,
        String platform,
        String status,
        int processedResults,
        int targetResults,
        int processedRuns,
        int totalKeywords,
        List<String> keywords,
        int creatorsEnriched,
        int enrichmentBatchesDispatched,
        int enrichmentBatchesCompleted,
        int progressPercent,
        String error,
        Instant createdAt,
        Instant completedAt
) {

    public static JobStatusResponse from(JobProgress p) {
        return new JobStatusResponse(
                p.jobId(),
                p.platform() != null ? p.platform().wireName() : null,
                p.status() != null ? p.status().name().toLowerCase(Locale.ROOT) : null,
                p.processedResults(),
                p.targetResults(),
                p.processedRuns(),
                p.totalKeywords(),
                p.keywords(),
                p.creatorsEnriched(),
                p.enrichmentBatchesDispatched(),
                p.enrichmentBatchesCompleted(),
                p.progressPercent(),
                p.error(),
                p.createdAt(),
                p.completedAt());
    }
}
