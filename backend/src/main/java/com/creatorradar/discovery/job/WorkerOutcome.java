package com.creatorradar.discovery.job;

import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJob.JobStatus;

import java.util.Locale;

/**
 * What a worker did with one delivery. Every outcome is a handled delivery (HTTP 200); infrastructure failures
 * are thrown instead so the queue redelivers.
 *
 * @param netNew creators this delivery added (search) or enriched (enrichment); null when not applicable
 */
public record WorkerOutcome(Kind kind, String jobId, JobStatus jobStatus, String message, Integer netNew,
                            Integer processedResults) {

    public enum Kind {
        /** Work done; the job carries on. */
        PROCESSED,
        COMPLETED,
        TIMEOUT,
        /** Delivery was a no-op (terminal or cancelled job). */
        SKIPPED,
        /** Business failure; the job was failed where applicable. */
        ERROR,
        /** Monitor rescheduled itself. */
        MONITORING,
        /** Monitor saw a job that has not started yet. */
        WAITING;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static WorkerOutcome of(Kind kind, DiscoveryJob job, String message) {
        return new WorkerOutcome(kind, job.getId(), job.getStatus(), message, null, job.getProcessedResults());
    }

    public static WorkerOutcome of(Kind kind, DiscoveryJob job, String message, int netNew) {
        return new WorkerOutcome(kind, job.getId(), job.getStatus(), message, netNew, job.getProcessedResults());
    }

    public static WorkerOutcome error(String jobId, String message) {
        return new WorkerOutcome(Kind.ERROR, jobId, null, message, null, null);
    }
}
