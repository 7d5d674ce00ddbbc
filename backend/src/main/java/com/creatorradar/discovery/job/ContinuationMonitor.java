package com.creatorradar.discovery.job;

import com.creatorradar.discovery.queue.MonitorMessage;
import com.creatorradar.discovery.queue.WorkerDispatcher;
import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJob.JobStatus;
import com.creatorradar.domain.DiscoveryJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Periodic check of a running job. Stops on terminal jobs, enforces the deadline, completes a PROCESSING job
 * whose keywords are all processed (a completion lost to a crash), and otherwise schedules exactly one
 * follow-up check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContinuationMonitor {

    private final DiscoveryJobRepository jobRepository;
    private final DiscoveryJobStateMachine stateMachine;
    private final WorkerDispatcher dispatcher;
    private final Clock clock;

    public WorkerOutcome process(MonitorMessage message, String callbackBaseUrl) {
        String jobId = message.jobId();
        DiscoveryJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Monitor: job {} not found", jobId);
            return WorkerOutcome.error(jobId, "Job not found");
        }
        if (job.isTerminal()) {
            log.debug("Monitor #{}: job {} is {}, stopping", message.attempt(), jobId, job.getStatus());
            return WorkerOutcome.of(WorkerOutcome.Kind.SKIPPED, job, "Job already " + job.getStatus());
        }
        if (stateMachine.checkTimeout(job, clock.instant())) {
            DiscoveryJob current = jobRepository.findById(jobId).orElse(job);
            return WorkerOutcome.of(WorkerOutcome.Kind.TIMEOUT, current, "Job exceeded its deadline");
        }
        if (job.getStatus() != JobStatus.PROCESSING) {
            log.debug("Monitor #{}: job {} is {}, waiting", message.attempt(), jobId, job.getStatus());
            return WorkerOutcome.of(WorkerOutcome.Kind.WAITING, job, "Job not started");
        }
        if (job.getProcessedRuns() >= job.getKeywords().size()) {
            log.info("Monitor #{}: job {} processed all {} keywords, completing", message.attempt(), jobId,
                    job.getKeywords().size());
            return stateMachine.complete(jobId)
                    .map(done -> WorkerOutcome.of(done.getStatus() == JobStatus.COMPLETED
                            ? WorkerOutcome.Kind.COMPLETED : WorkerOutcome.Kind.TIMEOUT, done, "Job " + done.getStatus()))
                    .orElseGet(() -> WorkerOutcome.of(WorkerOutcome.Kind.SKIPPED,
                            jobRepository.findById(jobId).orElse(job), "Job already finished"));
        }
        dispatcher.dispatchMonitor(callbackBaseUrl, message.next());
        return WorkerOutcome.of(WorkerOutcome.Kind.MONITORING, job,
                "Progress " + job.getProcessedResults() + "/" + job.getTargetResults());
    }
}
