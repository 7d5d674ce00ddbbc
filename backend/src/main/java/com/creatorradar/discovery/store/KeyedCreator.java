package com.creatorradar.discovery.store;

import com.creatorradar.domain.NormalizedCreator;

/**
 * A normalized creator together with its identity key.
 */
public record KeyedCreator(String identityKey, NormalizedCreator creator) {
}
