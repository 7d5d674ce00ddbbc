package com.creatorradar.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic retention cleanup of completed idempotency records.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerCleanupJob {

    private final IdempotencyLedger ledger;
    private final LedgerProperties properties;

    @Scheduled(cron = "${creatorradar.ledger.cleanup-cron:0 15 3 * * *}")
    public void runScheduled() {
        try {
            ledger.cleanup(properties.getRetention());
        } catch (DataAccessException e) {
            log.error("Idempotency ledger cleanup failed", e);
        }
    }
}
