package com.creatorradar.discovery.adapter;

import com.creatorradar.domain.Platform;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Suggests related search keywords for a set of seeds.
 */
public interface KeywordSuggestionClient {

    /**
     * @param count how many suggestions are wanted; the client may return fewer
     */
    Mono<List<String>> suggest(Platform platform, List<String> seeds, int count);
}
