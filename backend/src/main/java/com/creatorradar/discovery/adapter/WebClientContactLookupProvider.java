package com.creatorradar.discovery.adapter;

import com.creatorradar.discovery.config.EnrichmentProperties;
import com.creatorradar.discovery.config.ProviderProperties;
import com.creatorradar.domain.Platform;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Contact lookup over WebClient: {@code GET /v1/{platform}/profile?handle=}. Not rate limited; enrichment
 * batches are small and already staggered by the queue.
 */
public class WebClientContactLookupProvider implements ContactLookupProvider {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final List<String> BIO_FIELDS = List.of("signature", "biography", "description", "bio", "desc");
    private static final List<String> FOLLOWER_FIELDS =
            List.of("follower_count", "followerCount", "subscriberCountInt", "subscriberCount");

    private final WebClient webClient;
    private final ProviderProperties properties;
    private final EnrichmentProperties enrichmentProperties;
    private final ObjectMapper objectMapper;

    public WebClientContactLookupProvider(WebClient.Builder builder, ProviderProperties properties,
                                          EnrichmentProperties enrichmentProperties, ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = properties;
        this.enrichmentProperties = enrichmentProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ContactProfile> lookup(Platform platform, String handle) {
        String clean = handle.startsWith("@") ? handle.substring(1) : handle;
        return webClient.get()
                .uri(properties.getContactBaseUrl(), b -> b.path("/v1/{platform}/profile")
                        .queryParam("handle", clean)
                        .build(platform.wireName()))
                .header("x-api-key", properties.effectiveContactApiKey())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(enrichmentProperties.getRequestTimeoutMs()))
                .map(this::toProfile)
                .onErrorMap(e -> ProviderException.classify("Contact", e, properties.getRetryableStatuses()));
    }

    ContactProfile toProfile(String json) {
        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            throw new ProviderException("Contact lookup returned malformed JSON", false, 0, e);
        }
        Map<String, Object> user = payload.get("user") instanceof Map<?, ?> m ? cast(m) : payload;
        return new ContactProfile(
                firstString(user, BIO_FIELDS),
                firstString(user, List.of("email", "public_email", "business_email")),
                links(user),
                followers(user));
    }

    private static String firstString(Map<String, Object> map, List<String> fields) {
        for (String f : fields) {
            if (map.get(f) instanceof String s && !s.isBlank()) {
                return s;
            }
        }
        return null;
    }

    private static List<String> links(Map<String, Object> user) {
        List<String> out = new ArrayList<>();
        for (String field : List.of("bio_links", "links")) {
            if (user.get(field) instanceof List<?> list) {
                for (Object o : list) {
                    if (o instanceof Map<?, ?> link && link.get("url") instanceof String url && !url.isBlank()) {
                        out.add(url);
                    } else if (o instanceof String url && !url.isBlank()) {
                        out.add(url);
                    }
                }
            }
        }
        if (user.get("external_url") instanceof String ext && !ext.isBlank() && !out.contains(ext)) {
            out.add(ext);
        }
        return out;
    }

    private static Long followers(Map<String, Object> user) {
        for (String f : FOLLOWER_FIELDS) {
            Object v = user.get(f);
            if (v instanceof Number n && n.longValue() >= 0) {
                return n.longValue();
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> cast(Map<?, ?> m) {
        return (Map<String, Object>) m;
    }
}
