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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One discovery run covering a keyword set for one owner and platform.
 * Persisted in discovery_jobs. Status is only written through DiscoveryJobStateMachine; counters only via $inc.
 */
@Document(collection = "discovery_jobs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DiscoveryJob {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String ownerId;
    private Platform platform;
    private List<String> keywords = new ArrayList<>();
    private int targetResults;
    /** Net-new creators persisted so far. Soft target: a batch may overshoot targetResults. */
    private int processedResults;
    /** Search worker runs (one per keyword message) that finished. */
    private int processedRuns;
    /** Last opaque continuation token returned by the discovery provider. */
    private String cursor;
    @Indexed
    private JobStatus status;
    private String error;
    private Instant timeoutAt;
    private int enrichmentBatchesDispatched;
    private int enrichmentBatchesCompleted;
    private int creatorsEnriched;
    /** Search batch indexes already counted in processedRuns; guards $inc against redelivery. */
    private List<Integer> completedBatches = new ArrayList<>();
    /** Search batch indexes whose enrichment batches were already counted as dispatched. */
    private List<Integer> enrichmentDispatchedFor = new ArrayList<>();
    /** Enrichment batch ids ({@code searchBatch:batch}) already counted as completed. */
    private List<String> completedEnrichmentBatches = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /** True when the deadline is set and lies strictly before {@code now}. */
    public boolean isPastDeadline(Instant now) {
        return timeoutAt != null && timeoutAt.isBefore(now);
    }

    public enum JobStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        ERROR,
        TIMEOUT;

        public static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, PROCESSING);
        public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, ERROR, TIMEOUT);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }
    }
}
