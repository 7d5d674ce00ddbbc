package com.creatorradar.discovery.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Set;

/**
 * Discovery and contact provider endpoints (same vendor, separate keys allowed).
 */
@ConfigurationProperties(prefix = "creatorradar.discovery.provider")
@NoArgsConstructor
@Getter
@Setter
public class ProviderProperties {

    /** Base URL of the discovery (keyword search) API. */
    private String discoveryBaseUrl = "https://api.scrapecreators.com";

    /** Sent as x-api-key to the discovery API. */
    private String discoveryApiKey = "";

    /** Base URL of the contact (profile) API. */
    private String contactBaseUrl = "https://api.scrapecreators.com";

    /** Sent as x-api-key to the contact API. Falls back to the discovery key when blank. */
    private String contactApiKey = "";

    /** Discovery request budget per second for this instance (resilience4j limiter). */
    private int maxRequestsPerSecond = 10;

    /** How long a discovery call may wait for a limiter permit. */
    private long limiterTimeoutMs = 5_000;

    /** Timeout for one discovery page request. */
    private long requestTimeoutMs = 30_000;

    /** HTTP statuses treated as transient: the queue redelivers instead of failing the job. */
    private Set<Integer> retryableStatuses = Set.of(408, 429, 500, 502, 503, 504);

    public String effectiveContactApiKey() {
        return contactApiKey == null || contactApiKey.isBlank() ? discoveryApiKey : contactApiKey;
    }
}
