package com.creatorradar.discovery.job;

import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJob.JobStatus;
import com.creatorradar.domain.DiscoveryJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Times out active jobs whose deadline passed, so a job whose monitor chain died still reaches a terminal state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleJobSweeper {

    private final DiscoveryJobRepository jobRepository;
    private final DiscoveryJobStateMachine stateMachine;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${creatorradar.jobs.sweep-interval-ms:60000}")
    public void runScheduled() {
        try {
            sweep();
        } catch (DataAccessException e) {
            log.error("Stale job sweep failed", e);
        }
    }

    /**
     * @return number of jobs moved to TIMEOUT by this sweep
     */
    public int sweep() {
        Instant now = clock.instant();
        List<DiscoveryJob> stale = jobRepository.findByStatusInAndTimeoutAtBefore(JobStatus.ACTIVE, now);
        int timedOut = 0;
        for (DiscoveryJob job : stale) {
            if (stateMachine.timeout(job.getId()).isPresent()) {
                timedOut++;
            }
        }
        if (timedOut > 0) {
            log.info("Stale job sweep: {} of {} overdue jobs moved to TIMEOUT", timedOut, stale.size());
        }
        return timedOut;
    }
}
