package com.creatorradar.ledger;

import java.util.Locale;

/**
 * Why the ledger allowed or refused a delivery.
 */
public enum IdempotencyReason {
    NEW,
    ALREADY_COMPLETED,
    ALREADY_PROCESSING,
    RETRYING_FAILED;

    /** snake_case form returned in worker responses. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
