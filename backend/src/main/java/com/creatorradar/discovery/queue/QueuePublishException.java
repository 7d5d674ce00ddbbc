package com.creatorradar.discovery.queue;

/**
 * Thrown when a message could not be handed to the queue after all publish attempts.
 */
public class QueuePublishException extends RuntimeException {

    public QueuePublishException(String message) {
        super(message);
    }

    public QueuePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
