package com.creatorradar.discovery.queue;

import com.creatorradar.domain.Platform;

import java.util.List;

/**
 * One enrichment batch: up to batchSize identity keys produced by search batch {@code searchBatchIndex}.
 */
public record EnrichWorkerMessage(String jobId, Platform platform, List<String> identityKeys, int batchIndex,
                                  int totalBatches, String ownerId, int searchBatchIndex) implements WorkerMessage {

    @Override
    public String eventId() {
        return "enrich:" + jobId + ":" + searchBatchIndex + ":" + batchIndex;
    }

    /** Stable id of this batch within the job. */
    public String batchId() {
        return searchBatchIndex + ":" + batchIndex;
    }
}
