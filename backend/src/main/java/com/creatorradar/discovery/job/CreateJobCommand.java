package com.creatorradar.discovery.job;

import com.creatorradar.domain.Platform;

import java.util.List;

/**
 * Validated input for a new discovery job.
 */
public record CreateJobCommand(String ownerId, Platform platform, List<String> keywords, int targetResults,
                               boolean enableExpansion) {
}
