package com.creatorradar.discovery.store;

import com.creatorradar.domain.CreatorEnrichment;
import com.creatorradar.domain.JobCreator;
import com.creatorradar.domain.JobCreatorRepository;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.bulk.BulkWriteUpsert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Per-job creator persistence (job_creators). Insert-if-absent keyed by {@code jobId|identityKey}; later writes
 * only touch enrichment fields, so concurrent search and enrichment workers never overwrite each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobCreatorStore {

    private static final int DUPLICATE_KEY = 11000;

    private final MongoTemplate mongoTemplate;
    private final JobCreatorRepository repository;
    private final Clock clock;

    /**
     * Inserts the creators that the job does not know yet. Returns the creators owned by this search batch in
     * input order: the ones inserted now plus any a previous delivery of the same batch inserted, so a
     * redelivered batch reports the same net-new set.
     *
     * @param creators already deduplicated within the batch
     */
    public List<KeyedCreator> insertNew(String jobId, String keyword, int batchIndex, List<KeyedCreator> creators) {
        if (creators.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, JobCreator.class);
        for (KeyedCreator kc : creators) {
            Query query = Query.query(where("_id").is(JobCreator.documentId(jobId, kc.identityKey())));
            Update update = new Update()
                    .setOnInsert("jobId", jobId)
                    .setOnInsert("identityKey", kc.identityKey())
                    .setOnInsert("keyword", keyword)
                    .setOnInsert("batchIndex", batchIndex)
                    .setOnInsert("creator", kc.creator())
                    .setOnInsert("enriched", false)
                    .setOnInsert("createdAt", now);
            ops.upsert(query, update);
        }
        int inserted = executeIgnoringDuplicates(ops);

        Set<String> keys = creators.stream().map(KeyedCreator::identityKey).collect(Collectors.toSet());
        Set<String> owned = new HashSet<>();
        for (JobCreator stored : repository.findByJobIdAndIdentityKeyIn(jobId, keys)) {
            if (stored.getBatchIndex() == batchIndex) {
                owned.add(stored.getIdentityKey());
            }
        }
        List<KeyedCreator> netNew = new ArrayList<>(owned.size());
        for (KeyedCreator kc : creators) {
            if (owned.contains(kc.identityKey())) {
                netNew.add(kc);
            }
        }
        log.debug("Job {} batch {}: {} candidates, {} inserted now, {} owned by batch", jobId, batchIndex,
                creators.size(), inserted, netNew.size());
        return netNew;
    }

    /**
     * Creators first inserted by one search batch, as {@link #insertNew} reported them.
     */
    public List<KeyedCreator> findOwnedByBatch(String jobId, int batchIndex) {
        return repository.findByJobIdAndBatchIndexOrderByCreatedAtAscIdAsc(jobId, batchIndex).stream()
                .map(stored -> new KeyedCreator(stored.getIdentityKey(), stored.getCreator()))
                .toList();
    }

    public List<JobCreator> findByKeys(String jobId, List<String> identityKeys) {
        if (identityKeys.isEmpty()) {
            return List.of();
        }
        return repository.findByJobIdAndIdentityKeyIn(jobId, identityKeys);
    }

    /**
     * Merges contact data into one creator with targeted $set: the enrichment payload, the enriched flag and,
     * when known, the refreshed bio and follower count. Other fields are left untouched.
     *
     * @return true when the creator exists
     */
    public boolean mergeEnrichment(String jobId, String identityKey, CreatorEnrichment enrichment, String bio,
                                   Long followerCount) {
        Update update = new Update()
                .set("enriched", enrichment.getError() == null)
                .set("enrichment.email", enrichment.getEmail())
                .set("enrichment.emails", enrichment.getEmails())
                .set("enrichment.bioLinks", enrichment.getBioLinks())
                .set("enrichment.fetchedAt", enrichment.getFetchedAt())
                .set("enrichment.error", enrichment.getError());
        if (bio != null) {
            update.set("creator.bio", bio);
        }
        if (followerCount != null) {
            update.set("creator.followerCount", followerCount);
        }
        Query query = Query.query(where("_id").is(JobCreator.documentId(jobId, identityKey)));
        return mongoTemplate.updateFirst(query, update, JobCreator.class).getMatchedCount() > 0;
    }

    /**
     * Creators of a job in discovery order.
     */
    public List<JobCreator> page(String jobId, int offset, int limit) {
        Query query = Query.query(where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")))
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit));
        return mongoTemplate.find(query, JobCreator.class);
    }

    public long count(String jobId) {
        return repository.countByJobId(jobId);
    }

    public long deleteByJob(String jobId) {
        return repository.deleteByJobId(jobId);
    }

    /**
     * A duplicate-key error here means a concurrent batch inserted the same creator first, which is the
     * expected insert-if-absent outcome. Any other write error propagates.
     */
    private static int executeIgnoringDuplicates(BulkOperations ops) {
        try {
            return upserted(ops.execute());
        } catch (BulkOperationException e) {
            for (BulkWriteError error : e.getErrors()) {
                if (error.getCode() != DUPLICATE_KEY) {
                    throw e;
                }
            }
            return upserted(e.getResult());
        }
    }

    private static int upserted(BulkWriteResult result) {
        List<BulkWriteUpsert> upserts = result.getUpserts();
        return upserts != null ? upserts.size() : 0;
    }
}
