package com.creatorradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for result_batches.
 */
public interface ResultBatchRepository extends MongoRepository<ResultBatch, String> {

    long deleteByJobId(String jobId);
}
