package com.creatorradar.discovery.adapter;

import com.creatorradar.domain.Platform;
import reactor.core.publisher.Mono;

/**
 * Profile lookup used by enrichment to find biographies, emails and links.
 */
public interface ContactLookupProvider {

    Mono<ContactProfile> lookup(Platform platform, String handle);
}
