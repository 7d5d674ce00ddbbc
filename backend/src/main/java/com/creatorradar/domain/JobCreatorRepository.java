package com.creatorradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for job_creators. Inserts and enrichment merges go through JobCreatorStore.
 */
public interface JobCreatorRepository extends MongoRepository<JobCreator, String> {

    List<JobCreator> findByJobIdAndIdentityKeyIn(String jobId, Collection<String> identityKeys);

    List<JobCreator> findByJobIdAndBatchIndexOrderByCreatedAtAscIdAsc(String jobId, int batchIndex);

    long countByJobId(String jobId);

    long deleteByJobId(String jobId);
}
