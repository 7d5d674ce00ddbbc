package com.creatorradar.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Atomic single-document operations on discovery_jobs (MongoTemplate findAndModify / $inc).
 * Every method returns the document after the update, or empty when the guard did not match.
 */
public interface DiscoveryJobRepositoryCustom {

    /**
     * Sets status to {@code to} only if the current status is one of {@code from}.
     *
     * @param deadlineAfter when non-null, additionally requires timeoutAt to be null or after this instant
     * @param error         error message to store (null leaves the field untouched)
     */
    Optional<DiscoveryJob> transitionStatus(String jobId, Collection<DiscoveryJob.JobStatus> from,
                                            DiscoveryJob.JobStatus to, Instant deadlineAfter, String error,
                                            Instant now);

    /**
     * Adds {@code results} to processedResults and one run to processedRuns while the job is still active,
     * at most once per {@code batchIndex}. Stores {@code cursor} when non-null.
     * Empty when the job is terminal or the batch was already counted.
     */
    Optional<DiscoveryJob> incrementProgress(String jobId, int batchIndex, int results, String cursor, Instant now);

    /** Adds to enrichmentBatchesDispatched, at most once per search batch. */
    Optional<DiscoveryJob> incrementEnrichmentDispatched(String jobId, int searchBatchIndex, int batches,
                                                         Instant now);

    /**
     * Adds to creatorsEnriched and one to enrichmentBatchesCompleted, at most once per {@code enrichBatchId}.
     */
    Optional<DiscoveryJob> incrementEnrichmentCompleted(String jobId, String enrichBatchId, int creators,
                                                        Instant now);
}
