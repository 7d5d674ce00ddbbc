package com.creatorradar.discovery.job;

import com.creatorradar.config.CaffeineConfig;
import com.creatorradar.discovery.config.SearchProperties;
import com.creatorradar.discovery.keyword.KeywordExpander;
import com.creatorradar.discovery.queue.MonitorMessage;
import com.creatorradar.discovery.queue.QueuePublishException;
import com.creatorradar.discovery.queue.SearchWorkerMessage;
import com.creatorradar.discovery.queue.WorkerDispatcher;
import com.creatorradar.discovery.store.JobCreatorStore;
import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJob.JobStatus;
import com.creatorradar.domain.DiscoveryJobRepository;
import com.creatorradar.domain.ResultBatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job lifecycle entry points used by the HTTP API: create (and kick off the worker chain), read status and
 * results, delete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscoveryJobService {

    public static final int MAX_PAGE_SIZE = 200;

    private final DiscoveryJobRepository jobRepository;
    private final ResultBatchRepository resultBatchRepository;
    private final JobCreatorStore creatorStore;
    private final KeywordExpander keywordExpander;
    private final WorkerDispatcher dispatcher;
    private final DiscoveryJobStateMachine stateMachine;
    private final SearchProperties searchProperties;
    private final Clock clock;

    /**
     * Persists a PENDING job, then publishes the first {@code keywordFanOut} search messages and the first
     * monitor check. If publishing fails the job is failed and the exception propagates.
     */
    public CreatedJob create(CreateJobCommand command, String callbackBaseUrl) {
        List<String> keywords = keywordExpander.expand(command.platform(), command.keywords(),
                command.targetResults(), command.enableExpansion());
        Instant now = clock.instant();
        DiscoveryJob job = new DiscoveryJob();
        job.setId(UUID.randomUUID().toString());
        job.setOwnerId(command.ownerId());
        job.setPlatform(command.platform());
        job.setKeywords(keywords);
        job.setTargetResults(command.targetResults());
        job.setStatus(JobStatus.PENDING);
        job.setTimeoutAt(now.plus(searchProperties.timeoutFor(command.platform())));
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        jobRepository.save(job);
        log.info("Created job {} for owner {} on {}: {} keywords, target {}", job.getId(), command.ownerId(),
                command.platform(), keywords.size(), command.targetResults());

        int initial = Math.min(keywords.size(), Math.max(1, searchProperties.getKeywordFanOut()));
        try {
            for (int i = 0; i < initial; i++) {
                dispatcher.dispatchSearch(callbackBaseUrl, new SearchWorkerMessage(job.getId(), job.getPlatform(),
                        keywords.get(i), i, keywords.size(), job.getOwnerId(), job.getTargetResults()));
            }
            dispatcher.dispatchMonitor(callbackBaseUrl, new MonitorMessage(job.getId(), 0));
        } catch (QueuePublishException e) {
            stateMachine.fail(job.getId(), "Failed to dispatch workers: " + e.getMessage());
            throw e;
        }
        return new CreatedJob(job.getId(), keywords, initial);
    }

    /**
     * Terminal snapshots are cached briefly; active jobs are always read fresh.
     */
    @Cacheable(cacheNames = CaffeineConfig.JOB_STATUS_CACHE, key = "#jobId", unless = "#result == null || !#result.terminal()")
    public Optional<JobProgress> status(String jobId) {
        return jobRepository.findById(jobId).map(JobProgress::from);
    }

    public Optional<JobResultsPage> results(String jobId, int offset, int limit) {
        int safeOffset = Math.max(0, offset);
        int safeLimit = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        return jobRepository.findById(jobId).map(job -> new JobResultsPage(jobId, job.getStatus(),
                creatorStore.page(jobId, safeOffset, safeLimit), safeOffset, safeLimit, creatorStore.count(jobId)));
    }

    /**
     * Deletes the job with its result batches and creators. In-flight deliveries for the job then answer
     * "Job not found".
     *
     * @return false when the job did not exist
     */
    @CacheEvict(cacheNames = CaffeineConfig.JOB_STATUS_CACHE, key = "#jobId")
    public boolean delete(String jobId) {
        if (!jobRepository.existsById(jobId)) {
            return false;
        }
        long creators = creatorStore.deleteByJob(jobId);
        long batches = resultBatchRepository.deleteByJobId(jobId);
        jobRepository.deleteById(jobId);
        log.info("Deleted job {} with {} creators and {} result batches", jobId, creators, batches);
        return true;
    }
}
