package com.creatorradar.discovery.queue;

/**
 * Worker endpoint paths; the queue delivers to {@code callbackBaseUrl + path}.
 */
public final class WorkerPaths {

    public static final String BASE = "/api/v2/worker";
    public static final String SEARCH = BASE + "/search";
    public static final String ENRICH = BASE + "/enrich";
    public static final String MONITOR = BASE + "/monitor";

    private WorkerPaths() {
    }
}
