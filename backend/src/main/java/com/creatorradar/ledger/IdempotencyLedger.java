package com.creatorradar.ledger;

import com.creatorradar.domain.IdempotencyRecord;
import com.creatorradar.domain.IdempotencyRecord.IdempotencyStatus;
import com.creatorradar.domain.IdempotencyRecordRepository;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Durable dedup barrier keyed by external event id (idempotency_records).
 * <p>
 * The insert-if-absent is a single upsert with $setOnInsert, the only mutual-exclusion primitive in the
 * pipeline: of two racing deliveries exactly one sees NEW. Storage failures fail open (shouldProcess=true):
 * duplicate processing is tolerated, event loss is not.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyLedger {

    private final MongoTemplate mongoTemplate;
    private final IdempotencyRecordRepository repository;
    private final Clock clock;

    public IdempotencyCheckResult check(String eventId, String source, String eventType) {
        return check(eventId, source, eventType, null, null);
    }

    /**
     * Claims {@code eventId} for processing or explains why it must be skipped.
     *
     * @param eventTimestamp optional producer timestamp, stored for staleness checks
     * @param payload        optional raw body kept for replay/debugging
     */
    public IdempotencyCheckResult check(String eventId, String source, String eventType,
                                        Instant eventTimestamp, String payload) {
        try {
            if (insertIfAbsent(eventId, source, eventType, eventTimestamp, payload)) {
                log.info("New event {} ({}/{}), processing", eventId, source, eventType);
                return IdempotencyCheckResult.proceed(IdempotencyReason.NEW, null);
            }
            return resolveExisting(eventId, source, eventType);
        } catch (DataAccessException e) {
            log.error("Idempotency check failed for event {} ({}/{}); allowing processing", eventId, source,
                    eventType, e);
            return IdempotencyCheckResult.proceed(IdempotencyReason.NEW, null);
        }
    }

    /**
     * Marks the event COMPLETED. Storage errors are logged, not thrown: the work itself already happened.
     */
    public void markCompleted(String eventId) {
        try {
            Update update = new Update()
                    .set("status", IdempotencyStatus.COMPLETED)
                    .set("processedAt", clock.instant());
            mongoTemplate.updateFirst(byId(eventId), update, IdempotencyRecord.class);
            log.debug("Event {} completed", eventId);
        } catch (DataAccessException e) {
            log.error("Failed to mark event {} completed", eventId, e);
        }
    }

    /**
     * Marks the event FAILED so the next redelivery is let through as RETRYING_FAILED.
     */
    public void markFailed(String eventId, String errorMessage) {
        try {
            Update update = new Update()
                    .set("status", IdempotencyStatus.FAILED)
                    .set("errorMessage", errorMessage)
                    .set("processedAt", clock.instant());
            mongoTemplate.updateFirst(byId(eventId), update, IdempotencyRecord.class);
            log.warn("Event {} failed: {}", eventId, errorMessage);
        } catch (DataAccessException e) {
            log.error("Failed to mark event {} failed (original error: {})", eventId, errorMessage, e);
        }
    }

    /**
     * Deletes COMPLETED rows received before now - retention. FAILED rows are kept for diagnosis.
     *
     * @return number of rows deleted
     */
    public long cleanup(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        long deleted = repository.deleteByStatusAndReceivedAtBefore(IdempotencyStatus.COMPLETED, cutoff);
        log.info("Pruned {} completed idempotency records older than {} (cutoff {})", deleted, retention, cutoff);
        return deleted;
    }

    private boolean insertIfAbsent(String eventId, String source, String eventType,
                                   Instant eventTimestamp, String payload) {
        Update update = new Update()
                .setOnInsert("source", source)
                .setOnInsert("eventType", eventType)
                .setOnInsert("status", IdempotencyStatus.PROCESSING)
                .setOnInsert("retryCount", 0)
                .setOnInsert("receivedAt", clock.instant());
        if (eventTimestamp != null) {
            update.setOnInsert("eventTimestamp", eventTimestamp);
        }
        if (payload != null) {
            update.setOnInsert("payload", payload);
        }
        try {
            UpdateResult result = mongoTemplate.upsert(byId(eventId), update, IdempotencyRecord.class);
            return result.getUpsertedId() != null;
        } catch (DuplicateKeyException e) {
            // concurrent upsert on the same _id: the other delivery inserted first
            log.debug("Lost insert race for event {}", eventId);
            return false;
        }
    }

    private IdempotencyCheckResult resolveExisting(String eventId, String source, String eventType) {
        IdempotencyRecord existing = mongoTemplate.findById(eventId, IdempotencyRecord.class);
        if (existing == null || existing.getStatus() == null) {
            // row vanished between upsert and read (pruned); safest is to let this delivery through
            log.warn("Idempotency record {} disappeared after insert attempt; processing", eventId);
            return IdempotencyCheckResult.proceed(IdempotencyReason.NEW, null);
        }
        return switch (existing.getStatus()) {
            case COMPLETED -> {
                log.info("Event {} ({}/{}) already completed at {}; skipping", eventId, source, eventType,
                        existing.getProcessedAt());
                yield IdempotencyCheckResult.skip(IdempotencyReason.ALREADY_COMPLETED, existing);
            }
            case PROCESSING -> {
                log.info("Event {} ({}/{}) already processing (concurrent delivery); skipping", eventId, source,
                        eventType);
                yield IdempotencyCheckResult.skip(IdempotencyReason.ALREADY_PROCESSING, existing);
            }
            case FAILED -> reclaimFailed(eventId, source, eventType, existing);
        };
    }

    private IdempotencyCheckResult reclaimFailed(String eventId, String source, String eventType,
                                                 IdempotencyRecord previous) {
        Query failedOnly = Query.query(where("_id").is(eventId).and("status").is(IdempotencyStatus.FAILED));
        Update update = new Update()
                .set("status", IdempotencyStatus.PROCESSING)
                .inc("retryCount", 1)
                .unset("errorMessage");
        IdempotencyRecord reclaimed = mongoTemplate.findAndModify(failedOnly, update,
                FindAndModifyOptions.options().returnNew(true), IdempotencyRecord.class);
        if (reclaimed != null) {
            log.info("Retrying previously failed event {} ({}/{}), attempt {}, previous error: {}", eventId, source,
                    eventType, reclaimed.getRetryCount(), previous.getErrorMessage());
            return IdempotencyCheckResult.proceed(IdempotencyReason.RETRYING_FAILED, reclaimed);
        }
        IdempotencyRecord current = mongoTemplate.findById(eventId, IdempotencyRecord.class);
        if (current != null && current.getStatus() == IdempotencyStatus.COMPLETED) {
            return IdempotencyCheckResult.skip(IdempotencyReason.ALREADY_COMPLETED, current);
        }
        return IdempotencyCheckResult.skip(IdempotencyReason.ALREADY_PROCESSING, current);
    }

    private static Query byId(String eventId) {
        return Query.query(where("_id").is(eventId));
    }
}
