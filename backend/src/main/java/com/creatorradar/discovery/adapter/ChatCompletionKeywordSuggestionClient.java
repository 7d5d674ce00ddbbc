package com.creatorradar.discovery.adapter;

import com.creatorradar.discovery.config.KeywordExpansionProperties;
import com.creatorradar.domain.Platform;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword suggestions from an OpenAI-compatible chat-completions endpoint. The model is asked for a JSON array;
 * if it answers with prose instead, every double-quoted string is taken.
 */
@Slf4j
public class ChatCompletionKeywordSuggestionClient implements KeywordSuggestionClient {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private final WebClient webClient;
    private final KeywordExpansionProperties properties;
    private final ObjectMapper objectMapper;

    public ChatCompletionKeywordSuggestionClient(WebClient.Builder builder, KeywordExpansionProperties properties,
                                                 ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<List<String>> suggest(Platform platform, List<String> seeds, int count) {
        Map<String, Object> body = Map.of(
                "model", properties.getModel(),
                "temperature", 0.8,
                "max_tokens", 1000,
                "messages", List.of(
                        Map.of("role", "system", "content", "You are a " + platform.displayName()
                                + " marketing expert. Return ONLY a JSON array of search keyword strings."),
                        Map.of("role", "user", "content", "Generate exactly " + count + " unique "
                                + platform.displayName() + " search keywords for finding creators related to: "
                                + String.join(", ", seeds)
                                + ". Include niche terms, sub-niches, hashtag variations and audience-specific"
                                + " phrases. Return as a JSON array: [\"keyword1\", \"keyword2\", ...]")));
        return webClient.post()
                .uri(properties.getApiUrl())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                .map(this::parseSuggestions)
                .onErrorMap(e -> ProviderException.classify("Keyword expansion", e, Set.of()));
    }

    List<String> parseSuggestions(String json) {
        String content;
        try {
            JsonNode root = objectMapper.readTree(json);
            content = root.path("choices").path(0).path("message").path("content").asText("[]");
        } catch (Exception e) {
            throw new ProviderException("Keyword expansion returned malformed JSON", false, 0, e);
        }
        List<String> out = new ArrayList<>();
        try {
            JsonNode arr = objectMapper.readTree(content);
            if (arr.isArray()) {
                arr.forEach(n -> {
                    if (n.isTextual()) {
                        out.add(n.asText());
                    }
                });
                return out;
            }
        } catch (Exception e) {
            log.debug("Suggestion content is not a JSON array, falling back to quoted strings: {}", e.getMessage());
        }
        Matcher m = QUOTED.matcher(content);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }
}
