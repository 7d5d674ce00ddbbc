package com.creatorradar.api.dto;

import com.creatorradar.discovery.job.WorkerOutcome;
import com.creatorradar.ledger.IdempotencyReason;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Locale;

/**
 * Body returned to the queue by the worker endpoints. {@code status} is the outcome kind ("processed",
 * "completed", "error", ...), "skipped" with a ledger {@code reason} for duplicate deliveries, or "retry"
 * alongside a 503. A processed redelivery of a FAILED event carries reason "retrying_failed".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(
        String status,
        String reason,
        String jobId,
        String jobStatus,
        String message,
        Integer netNew,
        Integer processedResults
) {

    public static final String STATUS_SKIPPED = "skipped";
    public static final String STATUS_RETRY = "retry";

    public static WorkerResponse from(WorkerOutcome outcome) {
        return new WorkerResponse(
                outcome.kind().wireName(),
                null,
                outcome.jobId(),
                outcome.jobStatus() != null ? outcome.jobStatus().name().toLowerCase(Locale.ROOT) : null,
                outcome.message(),
                outcome.netNew(),
                outcome.processedResults());
    }

    /** Same response carrying the ledger reason, used when a FAILED delivery was reclaimed. */
    public WorkerResponse withReason(IdempotencyReason ledgerReason) {
        return new WorkerResponse(status, ledgerReason.wireName(), jobId, jobStatus, message, netNew, processedResults);
    }

    public static WorkerResponse duplicate(String jobId, IdempotencyReason reason) {
        return new WorkerResponse(STATUS_SKIPPED, reason.wireName(), jobId, null, "Duplicate delivery", null, null);
    }

    public static WorkerResponse error(String jobId, String message) {
        return new WorkerResponse(WorkerOutcome.Kind.ERROR.wireName(), null, jobId, null, message, null, null);
    }

    public static WorkerResponse retry(String jobId, String message) {
        return new WorkerResponse(STATUS_RETRY, null, jobId, null, message, null, null);
    }
}
