package com.creatorradar.discovery.job;

import com.creatorradar.domain.DiscoveryJob;
import com.creatorradar.domain.DiscoveryJob.JobStatus;
import com.creatorradar.domain.DiscoveryJobRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;

import static com.creatorradar.discovery.job.JobFixtures.CLOCK;
import static com.creatorradar.discovery.job.JobFixtures.NOW;
import static com.creatorradar.discovery.job.JobFixtures.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StaleJobSweeperTest {

    @Mock
    DiscoveryJobRepository jobRepository;
    @Mock
    DiscoveryJobStateMachine stateMachine;

    @Test
    void timesOutOverdueJobs() {
        DiscoveryJob a = job(JobStatus.PROCESSING, List.of("x"), 100);
        DiscoveryJob b = job(JobStatus.PENDING, List.of("x"), 100);
        b.setId("job-2");
        when(jobRepository.findByStatusInAndTimeoutAtBefore(JobStatus.ACTIVE, NOW)).thenReturn(List.of(a, b));
        when(stateMachine.timeout("job-1")).thenReturn(Optional.of(a));
        when(stateMachine.timeout("job-2")).thenReturn(Optional.empty());

        assertThat(new StaleJobSweeper(jobRepository, stateMachine, CLOCK).sweep()).isEqualTo(1);
    }

    @Test
    void scheduledRunSurvivesStorageFailure() {
        when(jobRepository.findByStatusInAndTimeoutAtBefore(JobStatus.ACTIVE, NOW))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatCode(() -> new StaleJobSweeper(jobRepository, stateMachine, CLOCK).runScheduled())
                .doesNotThrowAnyException();
    }
}
