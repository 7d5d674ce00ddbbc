package com.creatorradar.discovery.queue;

/**
 * Continuation monitor check number {@code attempt} (0-based) for a job.
 */
public record MonitorMessage(String jobId, int attempt) implements WorkerMessage {

    @Override
    public String eventId() {
        return "monitor:" + jobId + ":" + attempt;
    }

    public MonitorMessage next() {
        return new MonitorMessage(jobId, attempt + 1);
    }
}
