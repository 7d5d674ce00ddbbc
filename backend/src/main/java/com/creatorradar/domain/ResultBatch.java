package com.creatorradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Net-new creators produced by one search worker run for one keyword. Owned by the job; removed with it.
 */
@Document(collection = "result_batches")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ResultBatch {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String jobId;
    private String keyword;
    private int batchIndex;
    private List<NormalizedCreator> creators = new ArrayList<>();
    private Instant createdAt;
}
