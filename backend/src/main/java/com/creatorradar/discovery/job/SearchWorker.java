package com.creatorradar.discovery.job;

import com.creatorradar.discovery.adapter.DiscoveryProvider;
import com.creatorradar.discovery.adapter.ProviderException;
import com.creatorradar.discovery.adapter.ProviderPage;
import com.creatorradar.discovery.config.EnrichmentProperties;
import com.creatorradar.discovery.config.SearchProperties;
import com.creatorradar.discovery.identity.CreatorIdentityResolver;
import com.creatorradar.discovery.normalizer.CreatorNormalizer;
import com.creatorradar.discovery.queue.SearchWorkerMessage;
import com.creatorradar.discovery.queue.WorkerDispatcher;
import com.creatorradar.discovery.store.JobCreatorStore;
import com.creatorradar.discovery.store.KeyedCreator;
import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJobRepository;
import com.creatorradar.domain.NormalizedCreator;
import com.creatorradar.domain.Platform;
import com.creatorradar.domain.ResultBatch;
import com.creatorradar.domain.ResultBatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Processes one keyword of a job: fetch, normalize, dedupe, persist net-new creators, advance progress, then
 * fan out (enrichment) and either complete the job or chain the next keyword.
 * <p>
 * Retryable provider failures and storage or publish failures propagate so the delivery is retried. All
 * persistence steps are idempotent per (job, batchIndex). A redelivery of a batch whose progress was already
 * counted skips the provider and rebuilds its Result Batch and enrichment dispatch from the creators it stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchWorker {

    private final DiscoveryJobRepository jobRepository;
    private final ResultBatchRepository resultBatchRepository;
    private final DiscoveryJobStateMachine stateMachine;
    private final DiscoveryProvider discoveryProvider;
    private final CreatorNormalizer normalizer;
    private final CreatorIdentityResolver identityResolver;
    private final JobCreatorStore creatorStore;
    private final EnrichmentBatcher enrichmentBatcher;
    private final WorkerDispatcher dispatcher;
    private final SearchProperties searchProperties;
    private final EnrichmentProperties enrichmentProperties;
    private final Clock clock;

    public WorkerOutcome process(SearchWorkerMessage message, String callbackBaseUrl) {
        String jobId = message.jobId();
        DiscoveryJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Search worker: job {} not found", jobId);
            return WorkerOutcome.error(jobId, "Job not found");
        }
        if (job.isTerminal()) {
            log.debug("Search worker: job {} already {}, skipping batch {}", jobId, job.getStatus(),
                    message.batchIndex());
            return WorkerOutcome.of(WorkerOutcome.Kind.SKIPPED, job, "Job already " + job.getStatus());
        }
        if (stateMachine.checkTimeout(job, clock.instant())) {
            return timedOut(jobId);
        }
        DiscoveryJob running = stateMachine.start(jobId).orElse(null);
        if (running == null) {
            DiscoveryJob current = jobRepository.findById(jobId).orElse(job);
            return WorkerOutcome.of(WorkerOutcome.Kind.SKIPPED, current, "Job not running");
        }

        List<KeyedCreator> netNew = List.of();
        String cursor = null;
        if (running.getCompletedBatches().contains(message.batchIndex())) {
            // counted by an earlier delivery that failed afterwards; rebuild from what it stored
            netNew = creatorStore.findOwnedByBatch(jobId, message.batchIndex());
            log.info("Job {} batch {} redelivered after counting; reusing {} stored creators", jobId,
                    message.batchIndex(), netNew.size());
        } else if (running.getProcessedResults() >= running.getTargetResults()) {
            log.info("Job {} already has {}/{} results; skipping provider call for '{}'", jobId,
                    running.getProcessedResults(), running.getTargetResults(), message.keyword());
        } else {
            KeywordFetch fetch;
            try {
                fetch = fetchKeyword(running.getPlatform(), message.keyword());
            } catch (ProviderException e) {
                if (e.isRetryable()) {
                    throw e;
                }
                stateMachine.fail(jobId, e.getMessage());
                return WorkerOutcome.error(jobId, e.getMessage());
            }
            List<NormalizedCreator> normalized = normalizer.normalizeAll(running.getPlatform(), fetch.items());
            List<KeyedCreator> unique = dedupeWithKeys(normalized, running.getPlatform());
            netNew = creatorStore.insertNew(jobId, message.keyword(), message.batchIndex(), unique);
            cursor = fetch.cursor();
            log.info("Job {} keyword #{} '{}': {} items, {} unique, {} net-new", jobId, message.batchIndex(),
                    message.keyword(), fetch.items().size(), unique.size(), netNew.size());
        }

        saveResultBatch(message, netNew);
        DiscoveryJob progressed = jobRepository.incrementProgress(jobId, message.batchIndex(), netNew.size(), cursor,
                clock.instant()).orElse(null);
        if (progressed == null) {
            progressed = jobRepository.findById(jobId).orElse(null);
            if (progressed == null) {
                return WorkerOutcome.error(jobId, "Job not found");
            }
            if (progressed.isTerminal()) {
                return WorkerOutcome.of(WorkerOutcome.Kind.SKIPPED, progressed, "Job already " + progressed.getStatus());
            }
            log.debug("Job {} batch {} progress already counted", jobId, message.batchIndex());
        }

        if (stateMachine.checkTimeout(progressed, clock.instant())) {
            return timedOut(jobId);
        }
        if (!netNew.isEmpty() && enrichmentProperties.isEnabled()) {
            enrichmentBatcher.dispatch(progressed, message.batchIndex(),
                    netNew.stream().map(KeyedCreator::identityKey).toList(), callbackBaseUrl);
        }
        int added = netNew.size();
        if (progressed.getProcessedResults() >= progressed.getTargetResults()
                || progressed.getProcessedRuns() >= message.totalKeywords()) {
            return stateMachine.complete(jobId)
                    .map(done -> WorkerOutcome.of(done.getStatus() == DiscoveryJob.JobStatus.COMPLETED
                            ? WorkerOutcome.Kind.COMPLETED : WorkerOutcome.Kind.TIMEOUT, done,
                            "Job " + done.getStatus(), added))
                    .orElseGet(() -> current(jobId, WorkerOutcome.Kind.SKIPPED, "Job already finished"));
        }
        dispatchNextKeyword(progressed, message, callbackBaseUrl);
        return WorkerOutcome.of(WorkerOutcome.Kind.PROCESSED, progressed, "Batch processed", added);
    }

    private void dispatchNextKeyword(DiscoveryJob job, SearchWorkerMessage message, String callbackBaseUrl) {
        int next = message.batchIndex() + Math.max(1, searchProperties.getKeywordFanOut());
        List<String> keywords = job.getKeywords();
        if (next >= keywords.size()) {
            log.debug("Job {}: no keyword after #{}", job.getId(), message.batchIndex());
            return;
        }
        dispatcher.dispatchSearch(callbackBaseUrl, new SearchWorkerMessage(job.getId(), job.getPlatform(),
                keywords.get(next), next, message.totalKeywords(), job.getOwnerId(), job.getTargetResults()));
    }

    /**
     * Pages through the provider for one keyword. A failure on the first page propagates; a failure on a later
     * page ends paging and keeps what was fetched.
     */
    KeywordFetch fetchKeyword(Platform platform, String keyword) {
        int maxResults = searchProperties.getMaxResultsPerKeyword();
        List<Map<String, Object>> items = new ArrayList<>();
        String cursor = null;
        for (int run = 0; run < searchProperties.getMaxContinuationRuns() && items.size() < maxResults; run++) {
            ProviderPage page;
            try {
                page = discoveryProvider.search(platform, keyword, cursor).block();
            } catch (ProviderException e) {
                if (run == 0) {
                    throw e;
                }
                log.warn("Page {} for '{}' on {} failed, keeping {} items: {}", run + 1, keyword, platform,
                        items.size(), e.getMessage());
                break;
            }
            if (page == null) {
                break;
            }
            items.addAll(page.items());
            if (page.nextCursor() != null) {
                cursor = page.nextCursor();
            }
            if (!page.hasMore() || page.items().isEmpty()) {
                break;
            }
        }
        if (items.size() > maxResults) {
            items = new ArrayList<>(items.subList(0, maxResults));
        }
        return new KeywordFetch(items, cursor);
    }

    private List<KeyedCreator> dedupeWithKeys(List<NormalizedCreator> creators, Platform platform) {
        Map<String, KeyedCreator> unique = new LinkedHashMap<>();
        for (NormalizedCreator c : creators) {
            String key = identityResolver.identityKey(c, platform);
            unique.putIfAbsent(key, new KeyedCreator(key, c));
        }
        return new ArrayList<>(unique.values());
    }

    /** One batch per (job, batchIndex); a redelivery overwrites it with the same net-new set. */
    private void saveResultBatch(SearchWorkerMessage message, List<KeyedCreator> netNew) {
        ResultBatch batch = new ResultBatch();
        batch.setId(message.jobId() + ":" + message.batchIndex());
        batch.setJobId(message.jobId());
        batch.setKeyword(message.keyword());
        batch.setBatchIndex(message.batchIndex());
        batch.setCreators(netNew.stream().map(KeyedCreator::creator).toList());
        batch.setCreatedAt(clock.instant());
        resultBatchRepository.save(batch);
    }

    private WorkerOutcome timedOut(String jobId) {
        return current(jobId, WorkerOutcome.Kind.TIMEOUT, "Job exceeded its deadline");
    }

    private WorkerOutcome current(String jobId, WorkerOutcome.Kind kind, String message) {
        return jobRepository.findById(jobId)
                .map(j -> WorkerOutcome.of(kind, j, message))
                .orElseGet(() -> WorkerOutcome.error(jobId, "Job not found"));
    }

    record KeywordFetch(List<Map<String, Object>> items, String cursor) {
    }
}
