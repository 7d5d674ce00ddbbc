package com.creatorradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Contact data merged into a job creator by the enrichment worker. {@code error} is set per creator when the
 * lookup failed; the batch itself still succeeds.
 */
@NoArgsConstructor
@Getter
@Setter
public class CreatorEnrichment {

    private String email;
    private List<String> emails = new ArrayList<>();
    private List<String> bioLinks = new ArrayList<>();
    private Instant fetchedAt;
    private String error;
}
