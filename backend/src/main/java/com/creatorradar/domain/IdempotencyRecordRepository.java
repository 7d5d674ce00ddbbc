package com.creatorradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;

/**
 * Persistence for idempotency_records. The atomic insert-if-absent lives in IdempotencyLedger.
 */
public interface IdempotencyRecordRepository extends MongoRepository<IdempotencyRecord, String> {

    /** Retention cleanup; callers pass COMPLETED only. */
    long deleteByStatusAndReceivedAtBefore(IdempotencyRecord.IdempotencyStatus status, Instant cutoff);
}
