package com.creatorradar.discovery.queue;

/**
 * Body of a queue delivery to one of the worker endpoints.
 */
public interface WorkerMessage {

    String jobId();

    /**
     * Logical id of this message. Used as the queue deduplication id when publishing and as the ledger key
     * when receiving, so a duplicate publish and a duplicate delivery collapse to the same ledger row.
     */
    String eventId();
}
