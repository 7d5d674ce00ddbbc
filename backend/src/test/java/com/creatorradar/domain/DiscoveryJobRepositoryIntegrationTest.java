package com.creatorradar.domain;

import com.creatorradar.domain.DiscoveryJob.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Testcontainers
class DiscoveryJobRepositoryIntegrationTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    DiscoveryJobRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("concurrent progress updates from different batches all land; a repeated batch counts once")
    void concurrentProgress() throws Exception {
        save("job-1", JobStatus.PROCESSING);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            int batch = i % 8;
            futures.add(pool.submit(() -> {
                start.await();
                return repository.incrementProgress("job-1", batch, 5, null, NOW).isPresent();
            }));
        }
        start.countDown();
        int applied = 0;
        for (Future<Boolean> f : futures) {
            if (f.get()) {
                applied++;
            }
        }
        pool.shutdown();

        DiscoveryJob job = repository.findById("job-1").orElseThrow();
        assertThat(applied).isEqualTo(8);
        assertThat(job.getProcessedResults()).isEqualTo(40);
        assertThat(job.getProcessedRuns()).isEqualTo(8);
        assertThat(job.getCompletedBatches()).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7);
    }

    @Test
    @DisplayName("terminal jobs accept no progress")
    void terminalJobsAreFrozen() {
        save("job-1", JobStatus.COMPLETED);

        assertThat(repository.incrementProgress("job-1", 0, 5, "c1", NOW)).isEmpty();
        assertThat(repository.findById("job-1").orElseThrow().getProcessedResults()).isZero();
    }

    @Test
    @DisplayName("status transitions are guarded by the current status and the deadline")
    void guardedTransitions() {
        save("job-1", JobStatus.PENDING);

        assertThat(repository.transitionStatus("job-1", EnumSet.of(JobStatus.PENDING), JobStatus.PROCESSING,
                NOW, null, NOW)).isPresent();
        assertThat(repository.transitionStatus("job-1", EnumSet.of(JobStatus.PENDING), JobStatus.PROCESSING,
                NOW, null, NOW)).isEmpty();
        // deadline is NOW + 1h
        assertThat(repository.transitionStatus("job-1", JobStatus.ACTIVE, JobStatus.COMPLETED,
                NOW.plusSeconds(7200), null, NOW)).isEmpty();

        DiscoveryJob done = repository.transitionStatus("job-1", JobStatus.ACTIVE, JobStatus.COMPLETED,
                NOW, null, NOW).orElseThrow();
        assertThat(done.getStartedAt()).isEqualTo(NOW);
        assertThat(done.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("enrichment counters are exactly-once per batch")
    void enrichmentCounters() {
        save("job-1", JobStatus.COMPLETED);

        repository.incrementEnrichmentDispatched("job-1", 0, 3, NOW);
        repository.incrementEnrichmentDispatched("job-1", 0, 3, NOW);
        repository.incrementEnrichmentCompleted("job-1", "0:0", 25, NOW);
        repository.incrementEnrichmentCompleted("job-1", "0:0", 25, NOW);
        repository.incrementEnrichmentCompleted("job-1", "0:1", 10, NOW);

        DiscoveryJob job = repository.findById("job-1").orElseThrow();
        assertThat(job.getEnrichmentBatchesDispatched()).isEqualTo(3);
        assertThat(job.getEnrichmentBatchesCompleted()).isEqualTo(2);
        assertThat(job.getCreatorsEnriched()).isEqualTo(35);
    }

    private void save(String id, JobStatus status) {
        DiscoveryJob job = new DiscoveryJob();
        job.setId(id);
        job.setOwnerId("owner-1");
        job.setPlatform(Platform.TIKTOK);
        job.setKeywords(List.of("fitness"));
        job.setTargetResults(100);
        job.setStatus(status);
        job.setTimeoutAt(NOW.plusSeconds(3600));
        job.setCreatedAt(NOW);
        repository.save(job);
    }
}
