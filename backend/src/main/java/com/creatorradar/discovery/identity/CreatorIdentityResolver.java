package com.creatorradar.discovery.identity;

import com.creatorradar.domain.NormalizedCreator;
import com.creatorradar.domain.Platform;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Stable identity for discovered creator records across heterogeneous provider shapes.
 * <p>
 * Key format is {@code platform|candidate}: the first candidate produced by {@link #DEFAULT_RULES}, in rule
 * order, or {@code platform|hash:<sha256>} of the canonical JSON when no rule matches. Pure and deterministic.
 */
@Component
public class CreatorIdentityResolver {

    static final List<String> SCOPES = List.of(
            IdentityRule.ROOT, "profile", "account", "author", "owner", "user", "channel", "creator",
            "video", "post", "aweme_info", "node");

    /** Highest priority first. Handles beat numeric ids so one account seen via different shapes collapses. */
    public static final List<IdentityRule> DEFAULT_RULES = List.of(
            rule("tiktok-unique-id", "uniqueId"),
            rule("username", "username"),
            rule("handle", "handle"),
            rule("youtube-channel-id", "channelId"),
            rule("youtube-channel-id-snake", "channel_id"),
            rule("tiktok-sec-uid", "secUid"),
            rule("user-id", "userId"),
            rule("instagram-pk", "pk"),
            rule("id", "id"),
            rule("profile-url", "profileUrl"),
            rule("url", "url"),
            rule("short-id", "shortId"));

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final List<IdentityRule> rules;

    public CreatorIdentityResolver() {
        this(DEFAULT_RULES);
    }

    public CreatorIdentityResolver(List<IdentityRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Identity key for a raw record. Platform comes from the hint, else the record's {@code platform} field.
     */
    public String identityKey(Map<String, Object> record, Platform platformHint) {
        String platform = platformScope(record, platformHint);
        return candidate(record)
                .map(c -> platform + "|" + c)
                .orElseGet(() -> platform + "|hash:" + contentHash(record));
    }

    public String identityKey(NormalizedCreator creator, Platform platformHint) {
        Platform hint = platformHint != null ? platformHint : creator.getPlatform();
        return identityKey(creator.identityView(), hint);
    }

    /**
     * Order-preserving, first-seen-wins dedupe of raw records.
     */
    public List<Map<String, Object>> dedupe(List<Map<String, Object>> records, Platform platformHint) {
        return dedupeBy(records, r -> identityKey(r, platformHint));
    }

    public List<NormalizedCreator> dedupeCreators(List<NormalizedCreator> creators, Platform platformHint) {
        return dedupeBy(creators, c -> identityKey(c, platformHint));
    }

    private static <T> List<T> dedupeBy(List<T> items, Function<T, String> keyFn) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<T> out = new ArrayList<>(items.size());
        for (T item : items) {
            if (item != null && seen.add(keyFn.apply(item))) {
                out.add(item);
            }
        }
        return out;
    }

    private Optional<String> candidate(Map<String, Object> record) {
        for (IdentityRule rule : rules) {
            Optional<String> c = rule.extract(record);
            if (c.isPresent()) {
                return c;
            }
        }
        return Optional.empty();
    }

    private static String platformScope(Map<String, Object> record, Platform hint) {
        if (hint != null) {
            return hint.wireName();
        }
        Object p = record != null ? record.get("platform") : null;
        if (p instanceof CharSequence cs && !cs.toString().isBlank()) {
            return cs.toString().trim().toLowerCase(Locale.ROOT);
        }
        return "unknown";
    }

    static String contentHash(Map<String, Object> record) {
        String canonical;
        try {
            canonical = CANONICAL_JSON.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            canonical = String.valueOf(record);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static IdentityRule rule(String name, String field) {
        return new IdentityRule(name, field, SCOPES);
    }
}
