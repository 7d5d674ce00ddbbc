package com.creatorradar.discovery.adapter;

import java.util.List;
import java.util.Map;

/**
 * One page of raw discovery results. Items are opaque provider records; {@code nextCursor} is null when the
 * provider has no continuation.
 */
public record ProviderPage(List<Map<String, Object>> items, String nextCursor, boolean hasMore) {

    public static ProviderPage empty() {
        return new ProviderPage(List.of(), null, false);
    }
}
