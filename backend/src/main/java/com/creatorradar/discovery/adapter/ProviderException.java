package com.creatorradar.discovery.adapter;

import lombok.Getter;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Thrown when a provider call fails. {@code retryable} failures are handed back to the queue for redelivery;
 * the rest fail the job.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final boolean retryable;
    /** HTTP status when the provider answered, else 0. */
    private final int status;

    public ProviderException(String message, boolean retryable, int status) {
        super(message);
        this.retryable = retryable;
        this.status = status;
    }

    public ProviderException(String message, boolean retryable, int status, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.status = status;
    }

    /**
     * Classifies a WebClient failure. Connection failures and timeouts are retryable; HTTP errors are retryable
     * only when their status is in {@code retryableStatuses}.
     */
    public static ProviderException classify(String provider, Throwable error, Set<Integer> retryableStatuses) {
        if (error instanceof ProviderException pe) {
            return pe;
        }
        if (error instanceof WebClientResponseException wre) {
            int code = wre.getStatusCode().value();
            return new ProviderException(provider + " API error " + code + ": " + wre.getResponseBodyAsString(),
                    retryableStatuses.contains(code), code, wre);
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return new ProviderException(provider + " unreachable: " + error.getMessage(), true, 0, error);
        }
        return new ProviderException(provider + " call failed: " + error.getMessage(), false, 0, error);
    }
}
