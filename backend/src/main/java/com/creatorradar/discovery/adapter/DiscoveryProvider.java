package com.creatorradar.discovery.adapter;

import com.creatorradar.domain.Platform;
import reactor.core.publisher.Mono;

/**
 * Keyword search against the external discovery provider.
 */
public interface DiscoveryProvider {

    /**
     * Fetches one page for {@code keyword}.
     *
     * @param cursor continuation from the previous page, null for the first page
     * @return the page; errors surface as {@link ProviderException}
     */
    Mono<ProviderPage> search(Platform platform, String keyword, String cursor);
}
