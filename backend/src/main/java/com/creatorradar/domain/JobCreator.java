package com.creatorradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Creator known for one job, keyed by {@code jobId|identityKey}. Inserted once ($setOnInsert), then only its
 * enrichment fields are touched.
 */
@Document(collection = "job_creators")
@CompoundIndex(name = "job_identity", def = "{'jobId': 1, 'identityKey': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class JobCreator {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String jobId;
    private String identityKey;
    private String keyword;
    /** Search batch that first inserted this creator. */
    private int batchIndex;
    private NormalizedCreator creator;
    private boolean enriched;
    private CreatorEnrichment enrichment;
    private Instant createdAt;

    public static String documentId(String jobId, String identityKey) {
        return jobId + "|" + identityKey;
    }
}
