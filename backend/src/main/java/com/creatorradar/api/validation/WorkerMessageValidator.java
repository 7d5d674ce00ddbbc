package com.creatorradar.api.validation;

import com.creatorradar.discovery.queue.EnrichWorkerMessage;
import com.creatorradar.discovery.queue.MonitorMessage;
import com.creatorradar.discovery.queue.SearchWorkerMessage;
import com.creatorradar.domain.Platform;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses raw worker message bodies into typed messages. Structural checks only: whether the job exists is the
 * worker's concern. Every violation throws {@link MessageValidationException} naming the first bad field.
 */
@Component
@RequiredArgsConstructor
public class WorkerMessageValidator {

    private final ObjectMapper objectMapper;

    public SearchWorkerMessage search(byte[] body) {
        JsonNode root = readObject(body);
        String jobId = requireText(root, "jobId");
        Platform platform = requirePlatform(root);
        String keyword = requireText(root, "keyword").trim();
        if (!JobRequestValidator.isValidKeyword(keyword)) {
            throw new MessageValidationException("keyword must be " + JobRequestValidator.MIN_KEYWORD_LENGTH + ".."
                    + JobRequestValidator.MAX_KEYWORD_LENGTH + " characters");
        }
        int batchIndex = requireInt(root, "batchIndex", 0);
        int totalKeywords = requireInt(root, "totalKeywords", 1);
        if (batchIndex >= totalKeywords) {
            throw new MessageValidationException("batchIndex must be less than totalKeywords");
        }
        String ownerId = requireText(root, "ownerId");
        int targetResults = requireInt(root, "targetResults", 1);
        return new SearchWorkerMessage(jobId, platform, keyword, batchIndex, totalKeywords, ownerId, targetResults);
    }

    public EnrichWorkerMessage enrich(byte[] body) {
        JsonNode root = readObject(body);
        String jobId = requireText(root, "jobId");
        Platform platform = requirePlatform(root);
        JsonNode keysNode = root.path("identityKeys");
        if (!keysNode.isArray() || keysNode.isEmpty()) {
            throw new MessageValidationException("identityKeys must be a non-empty array");
        }
        List<String> identityKeys = new ArrayList<>(keysNode.size());
        for (JsonNode key : keysNode) {
            if (!key.isTextual() || key.asText().isBlank()) {
                throw new MessageValidationException("identityKeys must contain non-blank strings");
            }
            identityKeys.add(key.asText());
        }
        int batchIndex = requireInt(root, "batchIndex", 0);
        int totalBatches = requireInt(root, "totalBatches", 1);
        if (batchIndex >= totalBatches) {
            throw new MessageValidationException("batchIndex must be less than totalBatches");
        }
        String ownerId = root.path("ownerId").isTextual() ? root.path("ownerId").asText() : null;
        int searchBatchIndex = requireInt(root, "searchBatchIndex", 0);
        return new EnrichWorkerMessage(jobId, platform, List.copyOf(identityKeys), batchIndex, totalBatches, ownerId,
                searchBatchIndex);
    }

    /** {@code attempt} defaults to 0 for the first check. */
    public MonitorMessage monitor(byte[] body) {
        JsonNode root = readObject(body);
        String jobId = requireText(root, "jobId");
        int attempt = root.has("attempt") ? requireInt(root, "attempt", 0) : 0;
        return new MonitorMessage(jobId, attempt);
    }

    private JsonNode readObject(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MessageValidationException("Message body is required");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new MessageValidationException("Message body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageValidationException("Message body must be an object");
        }
        return root;
    }

    private static String requireText(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new MessageValidationException(field + " is required");
        }
        return node.asText();
    }

    private static Platform requirePlatform(JsonNode root) {
        JsonNode node = root.path("platform");
        return Platform.fromWire(node.isTextual() ? node.asText() : null)
                .orElseThrow(() -> new MessageValidationException("Invalid platform"));
    }

    private static int requireInt(JsonNode root, String field, int min) {
        JsonNode node = root.path(field);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new MessageValidationException(field + " must be an integer");
        }
        int value = node.asInt();
        if (value < min) {
            throw new MessageValidationException(field + " must be >= " + min);
        }
        return value;
    }
}
