package com.creatorradar.discovery.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Contact enrichment fan-out.
 */
@ConfigurationProperties(prefix = "creatorradar.discovery.enrichment")
@NoArgsConstructor
@Getter
@Setter
public class EnrichmentProperties {

    /** When false, search workers never dispatch enrichment batches. */
    private boolean enabled = true;

    /** Identity keys per enrichment message. */
    private int batchSize = 10;

    /** Batches delivered immediately; later batches are delayed in groups of this size. */
    private int maxConcurrentBatches = 5;

    /** Queue delay added per group of {@link #maxConcurrentBatches}. */
    private long staggerSeconds = 1;

    /** Timeout for one contact lookup. */
    private long requestTimeoutMs = 20_000;
}
