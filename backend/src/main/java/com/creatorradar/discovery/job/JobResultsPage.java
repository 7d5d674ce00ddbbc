package com.creatorradar.discovery.job;

import com.creatorradar.domain.DiscoveryJob.JobStatus;
import com.creatorradar.domain.JobCreator;

import java.util.List;

public record JobResultsPage(String jobId, JobStatus status, List<JobCreator> creators, int offset, int limit,
                             long total) {
}
