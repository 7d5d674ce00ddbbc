package com.creatorradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One row per external event/message id (the document id). COMPLETED is a permanent barrier against
 * reprocessing; FAILED rows are kept for triage and may be reclaimed by a redelivery.
 */
@Document(collection = "idempotency_records")
@CompoundIndex(name = "status_received", def = "{'status': 1, 'receivedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IdempotencyRecord {

    @Id
    @EqualsAndHashCode.Include
    private String eventId;
    private String source;
    private String eventType;
    private IdempotencyStatus status;
    private int retryCount;
    private String errorMessage;
    private Instant eventTimestamp;
    private Instant receivedAt;
    private Instant processedAt;
    /** Raw payload for replay/debugging; optional. */
    private String payload;

    public enum IdempotencyStatus {
        PROCESSING,
        COMPLETED,
        FAILED
    }
}
