package com.creatorradar.discovery.queue;

import java.time.Duration;

/**
 * Publishes one message to the push queue for delivery to {@code destinationUrl}.
 */
public interface QueuePublisher {

    /**
     * @param deduplicationId queue-side dedup id; the queue drops a second publish with the same id
     * @param delay           delivery delay, {@link Duration#ZERO} for immediate
     * @return the queue's message id
     * @throws QueuePublishException when the queue did not accept the message
     */
    String publish(String destinationUrl, Object body, String deduplicationId, Duration delay);
}
