package com.creatorradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Persistence for discovery_jobs. Mutations that race between workers live in {@link DiscoveryJobRepositoryCustom}.
 */
public interface DiscoveryJobRepository extends MongoRepository<DiscoveryJob, String>, DiscoveryJobRepositoryCustom {

    /** Active jobs whose deadline passed; used by the stale-job sweeper. */
    List<DiscoveryJob> findByStatusInAndTimeoutAtBefore(Collection<DiscoveryJob.JobStatus> statuses, Instant cutoff);
}
