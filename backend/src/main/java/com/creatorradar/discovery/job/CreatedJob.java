package com.creatorradar.discovery.job;

import java.util.List;

/**
 * @param workersDispatched search worker messages published at creation
 */
public record CreatedJob(String jobId, List<String> keywords, int workersDispatched) {
}
