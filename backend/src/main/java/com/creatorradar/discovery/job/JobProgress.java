package com.creatorradar.discovery.job;

import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJob.JobStatus;
import com.creatorradar.domain.Platform;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a job for status polling.
 */
public record JobProgress(String jobId, Platform platform, JobStatus status, int processedResults,
                          int targetResults, int processedRuns, int totalKeywords, List<String> keywords,
                          int creatorsEnriched, int enrichmentBatchesDispatched, int enrichmentBatchesCompleted,
                          int progressPercent, String error, Instant createdAt, Instant completedAt) {

    public boolean terminal() {
        return status != null && status.isTerminal();
    }

    public static JobProgress from(DiscoveryJob job) {
        return new JobProgress(job.getId(), job.getPlatform(), job.getStatus(), job.getProcessedResults(),
                job.getTargetResults(), job.getProcessedRuns(), job.getKeywords().size(), List.copyOf(job.getKeywords()),
                job.getCreatorsEnriched(), job.getEnrichmentBatchesDispatched(), job.getEnrichmentBatchesCompleted(),
                percent(job), job.getError(), job.getCreatedAt(), job.getCompletedAt());
    }

    /** 100 once completed; otherwise results over target, capped at 99 so an active job never reads as done. */
    static int percent(DiscoveryJob job) {
        if (job.getStatus() == JobStatus.COMPLETED) {
            return 100;
        }
        if (job.getTargetResults() <= 0) {
            return 0;
        }
        int pct = (int) Math.floor(job.getProcessedResults() * 100.0 / job.getTargetResults());
        return Math.max(0, Math.min(99, pct));
    }
}
