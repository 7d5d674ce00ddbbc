package com.creatorradar.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Idempotency ledger maintenance.
 */
@ConfigurationProperties(prefix = "creatorradar.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** COMPLETED rows older than this are pruned. FAILED rows are never pruned. */
    private Duration retention = Duration.ofDays(30);

    /** Cron for the cleanup job. Default daily at 03:15. */
    private String cleanupCron = "0 15 3 * * *";
}
