package com.creatorradar.discovery.job;

import com.creatorradar.discovery.config.EnrichmentProperties;
import com.creatorradar.discovery.queue.EnrichWorkerMessage;
import com.creatorradar.discovery.queue.WorkerDispatcher;
import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a search batch's net-new creators into enrichment messages of {@code batchSize} keys. The first
 * {@code maxConcurrentBatches} go out immediately; each following group is delayed by another
 * {@code staggerSeconds}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnrichmentBatcher {

    private final WorkerDispatcher dispatcher;
    private final EnrichmentProperties properties;
    private final DiscoveryJobRepository jobRepository;
    private final Clock clock;

    /**
     * @return number of enrichment messages published
     */
    public int dispatch(DiscoveryJob job, int searchBatchIndex, List<String> identityKeys, String callbackBaseUrl) {
        List<List<String>> batches = partition(identityKeys, Math.max(1, properties.getBatchSize()));
        if (batches.isEmpty()) {
            return 0;
        }
        for (int i = 0; i < batches.size(); i++) {
            EnrichWorkerMessage message = new EnrichWorkerMessage(job.getId(), job.getPlatform(), batches.get(i), i,
                    batches.size(), job.getOwnerId(), searchBatchIndex);
            dispatcher.dispatchEnrich(callbackBaseUrl, message, delayFor(i));
        }
        jobRepository.incrementEnrichmentDispatched(job.getId(), searchBatchIndex, batches.size(), clock.instant());
        log.info("Job {} search batch {}: dispatched {} enrichment batches for {} creators", job.getId(),
                searchBatchIndex, batches.size(), identityKeys.size());
        return batches.size();
    }

    Duration delayFor(int batchIndex) {
        int group = batchIndex / Math.max(1, properties.getMaxConcurrentBatches());
        return Duration.ofSeconds(group * properties.getStaggerSeconds());
    }

    static List<List<String>> partition(List<String> keys, int size) {
        List<List<String>> out = new ArrayList<>();
        for (int from = 0; from < keys.size(); from += size) {
            out.add(List.copyOf(keys.subList(from, Math.min(keys.size(), from + size))));
        }
        return out;
    }
}
