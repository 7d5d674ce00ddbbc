package com.creatorradar.discovery.queue;

/**
 * Delivery signature missing or invalid. Maps to 401.
 */
public class QueueSignatureException extends RuntimeException {

    public QueueSignatureException(String message) {
        super(message);
    }

    public QueueSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
