package com.creatorradar.discovery.adapter;

import com.creatorradar.discovery.config.ProviderProperties;
import com.creatorradar.domain.Platform;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Discovery provider over WebClient. One GET per page, throttled by a local resilience4j limiter.
 * <p>
 * Page shape differs per platform: TikTok returns {@code search_item_list} with a numeric {@code cursor},
 * Instagram returns {@code reels} without pagination, YouTube returns {@code videos} with a
 * {@code continuationToken}.
 */
@Slf4j
public class WebClientDiscoveryProvider implements DiscoveryProvider {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ProviderProperties properties;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public WebClientDiscoveryProvider(WebClient.Builder builder, ProviderProperties properties,
                                      RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ProviderPage> search(Platform platform, String keyword, String cursor) {
        return Mono.defer(() -> {
            if (!rateLimiter.acquirePermission()) {
                log.warn("Discovery limiter timeout before search on {} for '{}'", platform, keyword);
                return Mono.error(new ProviderException("Local limiter timeout before discovery call", true, 0));
            }
            return webClient.get()
                    .uri(properties.getDiscoveryBaseUrl(), b -> {
                        b.path("/v1/{platform}/search/keyword").queryParam("query", keyword);
                        if (cursor != null && !cursor.isBlank()) {
                            b.queryParam("cursor", cursor);
                        }
                        return b.build(platform.wireName());
                    })
                    .header("x-api-key", properties.getDiscoveryApiKey())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                    .map(json -> toPage(platform, json));
        }).onErrorMap(e -> ProviderException.classify("Discovery", e, properties.getRetryableStatuses()));
    }

    ProviderPage toPage(Platform platform, String json) {
        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            throw new ProviderException("Discovery returned malformed JSON", false, 0, e);
        }
        if (Boolean.FALSE.equals(payload.get("success"))) {
            Object message = payload.get("message");
            throw new ProviderException("Discovery returned success=false: "
                    + (message != null ? message : "no message"), false, 0);
        }
        return switch (platform) {
            case TIKTOK -> {
                List<Map<String, Object>> items = items(payload.get("search_item_list"));
                Object next = payload.get("cursor");
                boolean more = Boolean.TRUE.equals(payload.get("has_more")) && !items.isEmpty();
                yield new ProviderPage(items, more && next != null ? String.valueOf(next) : null, more);
            }
            case INSTAGRAM -> new ProviderPage(items(payload.get("reels")), null, false);
            case YOUTUBE -> {
                List<Map<String, Object>> items = items(payload.get("videos"));
                Object token = payload.get("continuationToken");
                boolean more = token instanceof String s && !s.isBlank() && !items.isEmpty();
                yield new ProviderPage(items, more ? (String) token : null, more);
            }
        };
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> items(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (o instanceof Map<?, ?> m) {
                out.add((Map<String, Object>) m);
            }
        }
        return out;
    }
}
