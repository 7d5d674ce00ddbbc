package com.creatorradar.discovery.queue;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Push queue (QStash protocol) publishing and signature settings.
 */
@ConfigurationProperties(prefix = "creatorradar.queue")
@NoArgsConstructor
@Getter
@Setter
public class QueueProperties {

    /** Queue API base URL. */
    private String baseUrl = "https://qstash.upstash.io";

    /** Bearer token for publishing. */
    private String token = "";

    /**
     * Public base URL of this service, used to build worker destinations. When blank the URL of the inbound
     * request that triggered the publish is used.
     */
    private String workerBaseUrl = "";

    /** HS256 key currently used by the queue to sign deliveries. */
    private String currentSigningKey = "";

    /** Key the queue rotates to next; accepted as a fallback. */
    private String nextSigningKey = "";

    /** Disable only for local development without the queue in front. */
    private boolean verifySignatures = true;

    /** Redelivery attempts the queue makes for a failed (non-2xx) delivery. */
    private int retries = 3;

    /** Delay between continuation monitor checks. */
    private Duration monitorDelay = Duration.ofSeconds(30);

    /** Tolerance applied to exp/nbf of delivery signatures. */
    private long clockSkewSeconds = 5;

    /** Attempts for one publish call before giving up. */
    private int publishMaxAttempts = 3;

    /** Base delay of the publish backoff. */
    private long publishBaseDelayMs = 200;

    private double publishJitterFactor = 0.2;

    /** Timeout for one publish HTTP call. */
    private long publishTimeoutMs = 10_000;
}
