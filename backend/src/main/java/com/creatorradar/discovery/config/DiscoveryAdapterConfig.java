package com.creatorradar.discovery.config;

import com.creatorradar.common.RetryPolicy;
import com.creatorradar.discovery.adapter.ChatCompletionKeywordSuggestionClient;
import com.creatorradar.discovery.adapter.ContactLookupProvider;
import com.creatorradar.discovery.adapter.DiscoveryProvider;
import com.creatorradar.discovery.adapter.KeywordSuggestionClient;
import com.creatorradar.discovery.adapter.WebClientContactLookupProvider;
import com.creatorradar.discovery.adapter.WebClientDiscoveryProvider;
import com.creatorradar.discovery.queue.QStashQueuePublisher;
import com.creatorradar.discovery.queue.QueueProperties;
import com.creatorradar.discovery.queue.QueuePublisher;
import com.creatorradar.ledger.LedgerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the outbound adapters (discovery, contact, keyword suggestions, queue) and registers all discovery
 * configuration properties.
 */
@Configuration
@EnableConfigurationProperties({ SearchProperties.class, EnrichmentProperties.class, ProviderProperties.class, KeywordExpansionProperties.class, QueueProperties.class, LedgerProperties.class })
public class DiscoveryAdapterConfig {

    public static final String DISCOVERY_RATE_LIMITER = "discoveryRateLimiter";

    @Bean(name = DISCOVERY_RATE_LIMITER)
    public RateLimiter discoveryRateLimiter(ProviderProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("discovery-provider", config);
    }

    @Bean
    public DiscoveryProvider discoveryProvider(WebClient.Builder webClientBuilder, ProviderProperties properties,
                                               @Qualifier(DISCOVERY_RATE_LIMITER) RateLimiter rateLimiter,
                                               ObjectMapper objectMapper) {
        return new WebClientDiscoveryProvider(webClientBuilder, properties, rateLimiter, objectMapper);
    }

    @Bean
    public ContactLookupProvider contactLookupProvider(WebClient.Builder webClientBuilder,
                                                       ProviderProperties properties,
                                                       EnrichmentProperties enrichmentProperties,
                                                       ObjectMapper objectMapper) {
        return new WebClientContactLookupProvider(webClientBuilder, properties, enrichmentProperties, objectMapper);
    }

    @Bean
    public KeywordSuggestionClient keywordSuggestionClient(WebClient.Builder webClientBuilder,
                                                           KeywordExpansionProperties properties,
                                                           ObjectMapper objectMapper) {
        return new ChatCompletionKeywordSuggestionClient(webClientBuilder, properties, objectMapper);
    }

    @Bean
    public QueuePublisher queuePublisher(WebClient.Builder webClientBuilder, QueueProperties properties) {
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getPublishBaseDelayMs(),
                properties.getPublishJitterFactor(),
                properties.getPublishMaxAttempts());
        return new QStashQueuePublisher(webClientBuilder, properties, retryPolicy);
    }
}
