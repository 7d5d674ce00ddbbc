package com.creatorradar.api.dto;

import java.util.List;

public record CreateJobResponse(String jobId, List<String> keywords, int workersDispatched, String message) {
}
