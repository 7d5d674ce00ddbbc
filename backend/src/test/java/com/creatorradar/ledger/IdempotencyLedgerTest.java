package com.creatorradar.ledger;

import com.creatorradar.domain.IdempotencyRecord;
import com.creatorradar.domain.IdempotencyRecord.IdempotencyStatus;
import com.creatorradar.domain.IdempotencyRecordRepository;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonString;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String EVENT_ID = "search:job-1:0";

    @Mock
    MongoTemplate mongoTemplate;
    @Mock
    IdempotencyRecordRepository repository;

    private IdempotencyLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new IdempotencyLedger(mongoTemplate, repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("first delivery inserts the row and proceeds as NEW")
    void newEvent() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(IdempotencyRecord.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, new BsonString(EVENT_ID)));

        IdempotencyCheckResult result = ledger.check(EVENT_ID, "qstash", "search");

        assertThat(result.shouldProcess()).isTrue();
        assertThat(result.reason()).isEqualTo(IdempotencyReason.NEW);
    }

    @Test
    @DisplayName("a completed event is skipped")
    void completedIsSkipped() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(IdempotencyRecord.class)))
                .thenReturn(UpdateResult.acknowledged(1, 0L, null));
        when(mongoTemplate.findById(EVENT_ID, IdempotencyRecord.class)).thenReturn(record(IdempotencyStatus.COMPLETED));

        IdempotencyCheckResult result = ledger.check(EVENT_ID, "qstash", "search");

        assertThat(result.shouldProcess()).isFalse();
        assertThat(result.reason()).isEqualTo(IdempotencyReason.ALREADY_COMPLETED);
    }

    @Test
    @DisplayName("losing the insert race skips as ALREADY_PROCESSING")
    void lostRace() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(IdempotencyRecord.class)))
                .thenThrow(new DuplicateKeyException("E11000"));
        when(mongoTemplate.findById(EVENT_ID, IdempotencyRecord.class))
                .thenReturn(record(IdempotencyStatus.PROCESSING));

        IdempotencyCheckResult result = ledger.check(EVENT_ID, "qstash", "search");

        assertThat(result.shouldProcess()).isFalse();
        assertThat(result.reason()).isEqualTo(IdempotencyReason.ALREADY_PROCESSING);
    }

    @Test
    @DisplayName("a failed event is reclaimed for retry")
    void failedIsRetried() {
        IdempotencyRecord failed = record(IdempotencyStatus.FAILED);
        failed.setErrorMessage("provider 503");
        IdempotencyRecord reclaimed = record(IdempotencyStatus.PROCESSING);
        reclaimed.setRetryCount(1);
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(IdempotencyRecord.class)))
                .thenReturn(UpdateResult.acknowledged(1, 0L, null));
        when(mongoTemplate.findById(EVENT_ID, IdempotencyRecord.class)).thenReturn(failed);
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(IdempotencyRecord.class))).thenReturn(reclaimed);

        IdempotencyCheckResult result = ledger.check(EVENT_ID, "qstash", "search");

        assertThat(result.shouldProcess()).isTrue();
        assertThat(result.reason()).isEqualTo(IdempotencyReason.RETRYING_FAILED);
        assertThat(result.existing().getRetryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("storage failures fail open")
    void failOpen() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(IdempotencyRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        IdempotencyCheckResult result = ledger.check(EVENT_ID, "qstash", "search");

        assertThat(result.shouldProcess()).isTrue();
        assertThat(result.reason()).isEqualTo(IdempotencyReason.NEW);
    }

    @Test
    @DisplayName("marking outcomes never throws")
    void markDoesNotThrow() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(IdempotencyRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatCode(() -> ledger.markCompleted(EVENT_ID)).doesNotThrowAnyException();
        assertThatCode(() -> ledger.markFailed(EVENT_ID, "boom")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("cleanup deletes completed rows older than the retention window")
    void cleanup() {
        when(repository.deleteByStatusAndReceivedAtBefore(IdempotencyStatus.COMPLETED, NOW.minus(Duration.ofDays(30))))
                .thenReturn(7L);

        assertThat(ledger.cleanup(Duration.ofDays(30))).isEqualTo(7L);
        verify(repository).deleteByStatusAndReceivedAtBefore(IdempotencyStatus.COMPLETED,
                Instant.parse("2026-01-30T10:00:00Z"));
    }

    private static IdempotencyRecord record(IdempotencyStatus status) {
        IdempotencyRecord r = new IdempotencyRecord();
        r.setEventId(EVENT_ID);
        r.setStatus(status);
        r.setReceivedAt(NOW.minusSeconds(60));
        return r;
    }
}
