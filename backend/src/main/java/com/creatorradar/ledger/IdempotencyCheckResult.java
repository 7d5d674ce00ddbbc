package com.creatorradar.ledger;

import com.creatorradar.domain.IdempotencyRecord;

/**
 * Outcome of {@link IdempotencyLedger#check}. {@code existing} is the row as observed, null for NEW.
 */
public record IdempotencyCheckResult(boolean shouldProcess, IdempotencyReason reason, IdempotencyRecord existing) {

    public static IdempotencyCheckResult proceed(IdempotencyReason reason, IdempotencyRecord existing) {
        return new IdempotencyCheckResult(true, reason, existing);
    }

    public static IdempotencyCheckResult skip(IdempotencyReason reason, IdempotencyRecord existing) {
        return new IdempotencyCheckResult(false, reason, existing);
    }
}
