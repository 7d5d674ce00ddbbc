package com.creatorradar.discovery.job;

import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJob.JobStatus;
import com.creatorradar.domain.DiscoveryJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;

/**
 * The only writer of {@link DiscoveryJob#getStatus()}. Each transition is one conditional findAndModify on the
 * allowed source states, so racing workers cannot both win and a terminal job is never left.
 * <pre>
 * PENDING ─start→ PROCESSING ─complete→ COMPLETED
 *    │                 ├─fail→ ERROR
 *    └────fail/timeout─┴─timeout→ TIMEOUT
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiscoveryJobStateMachine {

    static final String TIMEOUT_MESSAGE = "Job exceeded its deadline";

    private final DiscoveryJobRepository jobRepository;
    private final Clock clock;

    /**
     * PENDING → PROCESSING. Returns the job when it is PROCESSING afterwards (including when it already was),
     * empty when it is missing or terminal.
     */
    public Optional<DiscoveryJob> start(String jobId) {
        Instant now = clock.instant();
        Optional<DiscoveryJob> started = jobRepository.transitionStatus(jobId, EnumSet.of(JobStatus.PENDING),
                JobStatus.PROCESSING, null, null, now);
        if (started.isPresent()) {
            log.info("Job {} PENDING -> PROCESSING", jobId);
            return started;
        }
        return jobRepository.findById(jobId).filter(j -> j.getStatus() == JobStatus.PROCESSING);
    }

    /**
     * PROCESSING → COMPLETED while the deadline has not passed. When the deadline has passed the job goes to
     * TIMEOUT instead. Returns the job in its resulting terminal state, empty when neither transition applied
     * (already terminal, or not started).
     */
    public Optional<DiscoveryJob> complete(String jobId) {
        Instant now = clock.instant();
        Optional<DiscoveryJob> completed = jobRepository.transitionStatus(jobId, EnumSet.of(JobStatus.PROCESSING),
                JobStatus.COMPLETED, now, null, now);
        if (completed.isPresent()) {
            DiscoveryJob job = completed.get();
            log.info("Job {} COMPLETED: {}/{} results over {} runs", jobId, job.getProcessedResults(),
                    job.getTargetResults(), job.getProcessedRuns());
            return completed;
        }
        Optional<DiscoveryJob> current = jobRepository.findById(jobId);
        if (current.isPresent() && !current.get().isTerminal() && current.get().isPastDeadline(now)) {
            return timeout(jobId);
        }
        return Optional.empty();
    }

    /**
     * PENDING|PROCESSING → ERROR with {@code message}.
     */
    public Optional<DiscoveryJob> fail(String jobId, String message) {
        Optional<DiscoveryJob> failed = jobRepository.transitionStatus(jobId, JobStatus.ACTIVE, JobStatus.ERROR,
                null, message, clock.instant());
        failed.ifPresent(j -> log.warn("Job {} ERROR: {}", jobId, message));
        return failed;
    }

    /**
     * PENDING|PROCESSING → TIMEOUT. Callers check the deadline first; deadlines only move into the past, so a
     * stale read cannot time out a job early.
     */
    public Optional<DiscoveryJob> timeout(String jobId) {
        Optional<DiscoveryJob> timedOut = jobRepository.transitionStatus(jobId, JobStatus.ACTIVE, JobStatus.TIMEOUT,
                null, TIMEOUT_MESSAGE, clock.instant());
        timedOut.ifPresent(j -> log.warn("Job {} TIMEOUT (deadline {}) with {}/{} results", jobId, j.getTimeoutAt(),
                j.getProcessedResults(), j.getTargetResults()));
        return timedOut;
    }

    /**
     * Deadline guard every worker runs first. True when the job is active, past its deadline, and is now
     * TIMEOUT (by this call or a concurrent one).
     */
    public boolean checkTimeout(DiscoveryJob job, Instant now) {
        if (job.isTerminal() || !job.isPastDeadline(now)) {
            return false;
        }
        timeout(job.getId());
        return true;
    }
}
