package com.creatorradar.discovery.job;

import com.creatorradar.discovery.adapter.ContactLookupProvider;
import com.creatorradar.discovery.adapter.ContactProfile;
import com.creatorradar.discovery.config.EnrichmentProperties;
import com.creatorradar.discovery.normalizer.EmailExtractor;
import com.creatorradar.discovery.queue.EnrichWorkerMessage;
import com.creatorradar.discovery.store.JobCreatorStore;
import com.creatorradar.domain.CreatorEnrichment;
import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJob.JobStatus;
import com.creatorradar.domain.DiscoveryJobRepository;
import com.creatorradar.domain.JobCreator;
import com.creatorradar.domain.NormalizedCreator;
import com.creatorradar.domain.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Looks up contact data for one enrichment batch and merges it into the job's creators by identity key.
 * Lookups run in parallel; a failed lookup is recorded on that creator and does not fail the batch.
 * Runs for PROCESSING and COMPLETED jobs; PENDING, ERROR and TIMEOUT jobs are left alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrichmentWorker {

    private final DiscoveryJobRepository jobRepository;
    private final DiscoveryJobStateMachine stateMachine;
    private final JobCreatorStore creatorStore;
    private final ContactLookupProvider contactLookupProvider;
    private final EnrichmentProperties properties;
    private final Clock clock;

    public WorkerOutcome process(EnrichWorkerMessage message) {
        String jobId = message.jobId();
        DiscoveryJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Enrichment worker: job {} not found", jobId);
            return WorkerOutcome.error(jobId, "Job not found");
        }
        if (stateMachine.checkTimeout(job, clock.instant())) {
            return WorkerOutcome.of(WorkerOutcome.Kind.SKIPPED, job, "Job timed out");
        }
        if (job.getStatus() != JobStatus.PROCESSING && job.getStatus() != JobStatus.COMPLETED) {
            log.debug("Enrichment worker: job {} is {}, skipping batch {}", jobId, job.getStatus(), message.batchId());
            return WorkerOutcome.of(WorkerOutcome.Kind.SKIPPED, job, "Job is " + job.getStatus());
        }

        List<JobCreator> creators = creatorStore.findByKeys(jobId, message.identityKeys());
        List<EnrichedCreator> results = Flux.fromIterable(creators)
                .flatMap(c -> enrich(message.platform(), c), Math.max(1, creators.size()))
                .collectList()
                .block(batchTimeout());
        int enriched = 0;
        for (EnrichedCreator r : results != null ? results : List.<EnrichedCreator>of()) {
            creatorStore.mergeEnrichment(jobId, r.identityKey(), r.enrichment(), r.bio(), r.followerCount());
            if (r.enrichment().getError() == null) {
                enriched++;
            }
        }
        DiscoveryJob updated = jobRepository.incrementEnrichmentCompleted(jobId, message.batchId(), enriched,
                clock.instant()).orElse(job);
        log.info("Job {} enrichment batch {}/{} ({}): {}/{} creators enriched", jobId, message.batchIndex() + 1,
                message.totalBatches(), message.batchId(), enriched, creators.size());
        return WorkerOutcome.of(WorkerOutcome.Kind.PROCESSED, updated, "Enriched " + enriched + "/" + creators.size(),
                enriched);
    }

    /** Lookups run in parallel and each carries its own timeout; twice that bounds the whole batch. */
    private Duration batchTimeout() {
        return Duration.ofMillis(2 * Math.max(1L, properties.getRequestTimeoutMs()));
    }

    private Mono<EnrichedCreator> enrich(Platform platform, JobCreator jobCreator) {
        NormalizedCreator creator = jobCreator.getCreator();
        String handle = creator != null ? firstNonBlank(creator.getHandle(), creator.getExternalId()) : null;
        if (handle == null) {
            return Mono.just(failed(jobCreator, "No handle to look up"));
        }
        return contactLookupProvider.lookup(platform, handle)
                .map(profile -> succeeded(jobCreator, profile))
                .defaultIfEmpty(failed(jobCreator, "Empty profile response"))
                .onErrorResume(e -> {
                    log.debug("Contact lookup failed for {}: {}", jobCreator.getIdentityKey(), e.getMessage());
                    return Mono.just(failed(jobCreator, e.getMessage()));
                });
    }

    private EnrichedCreator succeeded(JobCreator jobCreator, ContactProfile profile) {
        Set<String> emails = new LinkedHashSet<>();
        if (profile.email() != null && !profile.email().isBlank()) {
            emails.addAll(EmailExtractor.fromText(profile.email()));
        }
        emails.addAll(EmailExtractor.extract(profile.bio(), profile.links()));
        NormalizedCreator creator = jobCreator.getCreator();
        if (creator != null && creator.getEmails() != null) {
            emails.addAll(creator.getEmails());
        }
        CreatorEnrichment enrichment = new CreatorEnrichment();
        enrichment.setEmails(new ArrayList<>(emails));
        enrichment.setEmail(emails.isEmpty() ? null : emails.iterator().next());
        enrichment.setBioLinks(profile.links() != null ? new ArrayList<>(profile.links()) : new ArrayList<>());
        enrichment.setFetchedAt(clock.instant());
        return new EnrichedCreator(jobCreator.getIdentityKey(), enrichment, profile.bio(), profile.followerCount());
    }

    private EnrichedCreator failed(JobCreator jobCreator, String error) {
        CreatorEnrichment enrichment = new CreatorEnrichment();
        enrichment.setFetchedAt(clock.instant());
        enrichment.setError(error != null ? error : "Lookup failed");
        return new EnrichedCreator(jobCreator.getIdentityKey(), enrichment, null, null);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    private record EnrichedCreator(String identityKey, CreatorEnrichment enrichment, String bio, Long followerCount) {
    }
}
