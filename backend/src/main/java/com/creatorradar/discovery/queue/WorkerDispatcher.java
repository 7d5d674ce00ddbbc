package com.creatorradar.discovery.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Publishes worker messages to their endpoints. The message's logical event id doubles as the queue
 * deduplication id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerDispatcher {

    private final QueuePublisher publisher;
    private final QueueProperties properties;

    public String dispatchSearch(String callbackBaseUrl, SearchWorkerMessage message) {
        log.info("Dispatching search worker for job {} keyword #{} '{}'", message.jobId(), message.batchIndex(),
                message.keyword());
        return publish(callbackBaseUrl, WorkerPaths.SEARCH, message, Duration.ZERO);
    }

    public String dispatchEnrich(String callbackBaseUrl, EnrichWorkerMessage message, Duration delay) {
        return publish(callbackBaseUrl, WorkerPaths.ENRICH, message, delay);
    }

    /** Monitor checks always go out after the configured monitor delay. */
    public String dispatchMonitor(String callbackBaseUrl, MonitorMessage message) {
        log.debug("Scheduling monitor #{} for job {} in {}", message.attempt(), message.jobId(),
                properties.getMonitorDelay());
        return publish(callbackBaseUrl, WorkerPaths.MONITOR, message, properties.getMonitorDelay());
    }

    private String publish(String callbackBaseUrl, String path, WorkerMessage message, Duration delay) {
        return publisher.publish(destination(callbackBaseUrl, path), message, message.eventId(), delay);
    }

    String destination(String callbackBaseUrl, String path) {
        String configured = properties.getWorkerBaseUrl();
        String base = configured != null && !configured.isBlank() ? configured : callbackBaseUrl;
        if (base == null || base.isBlank()) {
            throw new QueuePublishException("No callback base URL for " + path);
        }
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + path;
    }
}
