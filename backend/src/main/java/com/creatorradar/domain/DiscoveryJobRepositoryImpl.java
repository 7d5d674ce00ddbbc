package com.creatorradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed atomic updates for discovery_jobs. No read-modify-write in application code.
 */
@Repository
@RequiredArgsConstructor
public class DiscoveryJobRepositoryImpl implements DiscoveryJobRepositoryCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<DiscoveryJob> transitionStatus(String jobId, Collection<DiscoveryJob.JobStatus> from,
                                                   DiscoveryJob.JobStatus to, Instant deadlineAfter, String error,
                                                   Instant now) {
        Criteria criteria = where("_id").is(jobId).and("status").in(from);
        if (deadlineAfter != null) {
            criteria = criteria.orOperator(
                    where("timeoutAt").is(null),
                    where("timeoutAt").gt(deadlineAfter));
        }
        Update update = new Update()
                .set("status", to)
                .set("updatedAt", now);
        if (to == DiscoveryJob.JobStatus.PROCESSING) {
            update.set("startedAt", now);
        }
        if (to.isTerminal()) {
            update.set("completedAt", now);
        }
        if (error != null) {
            update.set("error", error);
        }
        return Optional.ofNullable(
                mongoTemplate.findAndModify(new Query(criteria), update, RETURN_NEW, DiscoveryJob.class));
    }

    @Override
    public Optional<DiscoveryJob> incrementProgress(String jobId, int batchIndex, int results, String cursor,
                                                    Instant now) {
        Query query = Query.query(where("_id").is(jobId)
                .and("status").in(DiscoveryJob.JobStatus.ACTIVE)
                .and("completedBatches").ne(batchIndex));
        Update update = new Update()
                .inc("processedResults", Math.max(0, results))
                .inc("processedRuns", 1)
                .addToSet("completedBatches", batchIndex)
                .set("updatedAt", now);
        if (cursor != null) {
            update.set("cursor", cursor);
        }
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, DiscoveryJob.class));
    }

    @Override
    public Optional<DiscoveryJob> incrementEnrichmentDispatched(String jobId, int searchBatchIndex, int batches,
                                                                Instant now) {
        Query query = Query.query(where("_id").is(jobId).and("enrichmentDispatchedFor").ne(searchBatchIndex));
        Update update = new Update()
                .inc("enrichmentBatchesDispatched", Math.max(0, batches))
                .addToSet("enrichmentDispatchedFor", searchBatchIndex)
                .set("updatedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, DiscoveryJob.class));
    }

    @Override
    public Optional<DiscoveryJob> incrementEnrichmentCompleted(String jobId, String enrichBatchId, int creators,
                                                               Instant now) {
        Query query = Query.query(where("_id").is(jobId).and("completedEnrichmentBatches").ne(enrichBatchId));
        Update update = new Update()
                .inc("creatorsEnriched", Math.max(0, creators))
                .inc("enrichmentBatchesCompleted", 1)
                .addToSet("completedEnrichmentBatches", enrichBatchId)
                .set("updatedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, DiscoveryJob.class));
    }
}
