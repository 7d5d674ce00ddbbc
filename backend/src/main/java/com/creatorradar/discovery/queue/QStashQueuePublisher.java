package com.creatorradar.discovery.queue;

import com.creatorradar.common.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;

/**
 * QStash publish over WebClient: {@code POST {baseUrl}/v2/publish/{destination}} with bearer token, retry count,
 * delay and deduplication id headers. Transient failures (connect errors, 429, 5xx) are retried with
 * {@link RetryPolicy} backoff.
 */
@Slf4j
public class QStashQueuePublisher implements QueuePublisher {

    private final WebClient webClient;
    private final QueueProperties properties;
    private final RetryPolicy retryPolicy;

    public QStashQueuePublisher(WebClient.Builder builder, QueueProperties properties, RetryPolicy retryPolicy) {
        this.webClient = builder.build();
        this.properties = properties;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String publish(String destinationUrl, Object body, String deduplicationId, Duration delay) {
        Exception lastException = null;
        for (int attempt = 0; retryPolicy.canRetry(attempt); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(retryPolicy.delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new QueuePublishException("Interrupted during publish retry", e);
                }
            }
            try {
                String messageId = publishOnce(destinationUrl, body, deduplicationId, delay);
                log.debug("Published {} to {} (messageId={}, delay={})", deduplicationId, destinationUrl,
                        messageId, delay);
                return messageId;
            } catch (WebClientResponseException e) {
                int code = e.getStatusCode().value();
                if (code != 429 && code < 500) {
                    throw new QueuePublishException("Queue rejected " + deduplicationId + " with " + code + ": "
                            + e.getResponseBodyAsString(), e);
                }
                log.warn("Publish of {} failed with {} (attempt {}/{})", deduplicationId, code, attempt + 1,
                        retryPolicy.getMaxAttempts());
                lastException = e;
            } catch (WebClientRequestException | IllegalStateException e) {
                log.warn("Publish of {} failed: {} (attempt {}/{})", deduplicationId, e.getMessage(), attempt + 1,
                        retryPolicy.getMaxAttempts());
                lastException = e;
            }
        }
        throw new QueuePublishException("Publish of " + deduplicationId + " failed after "
                + retryPolicy.getMaxAttempts() + " attempts", lastException);
    }

    private String publishOnce(String destinationUrl, Object body, String deduplicationId, Duration delay) {
        WebClient.RequestBodySpec request = webClient.post()
                .uri(URI.create(stripTrailingSlash(properties.getBaseUrl()) + "/v2/publish/" + destinationUrl))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken())
                .header("Upstash-Retries", String.valueOf(properties.getRetries()))
                .header("Upstash-Deduplication-Id", deduplicationId)
                .contentType(MediaType.APPLICATION_JSON);
        if (delay != null && !delay.isZero() && !delay.isNegative()) {
            request = request.header("Upstash-Delay", delay.toSeconds() + "s");
        }
        JsonNode response = request.bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(Duration.ofMillis(properties.getPublishTimeoutMs()));
        return response != null ? response.path("messageId").asText(null) : null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
