package com.creatorradar.discovery.queue;

import com.creatorradar.domain.Platform;

/**
 * Asks the search worker to process keyword {@code batchIndex} of a job.
 */
public record SearchWorkerMessage(String jobId, Platform platform, String keyword, int batchIndex,
                                  int totalKeywords, String ownerId, int targetResults) implements WorkerMessage {

    @Override
    public String eventId() {
        return "search:" + jobId + ":" + batchIndex;
    }
}
