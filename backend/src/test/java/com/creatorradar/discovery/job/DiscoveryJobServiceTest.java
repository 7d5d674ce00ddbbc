package com.creatorradar.discovery.job;

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
import com.creatorradar.domain.Platform;
import com.creatorradar.domain.ResultBatchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.creatorradar.discovery.job.JobFixtures.BASE_URL;
import static com.creatorradar.discovery.job.JobFixtures.CLOCK;
import static com.creatorradar.discovery.job.JobFixtures.JOB_ID;
import static com.creatorradar.discovery.job.JobFixtures.NOW;
import static com.creatorradar.discovery.job.JobFixtures.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryJobServiceTest {

    @Mock
    DiscoveryJobRepository jobRepository;
    @Mock
    ResultBatchRepository resultBatchRepository;
    @Mock
    JobCreatorStore creatorStore;
    @Mock
    KeywordExpander keywordExpander;
    @Mock
    WorkerDispatcher dispatcher;
    @Mock
    DiscoveryJobStateMachine stateMachine;

    private SearchProperties searchProperties;
    private DiscoveryJobService service;

    @BeforeEach
    void setUp() {
        searchProperties = new SearchProperties();
        service = new DiscoveryJobService(jobRepository, resultBatchRepository, creatorStore, keywordExpander,
                dispatcher, stateMachine, searchProperties, CLOCK);
    }

    @Test
    @DisplayName("create saves a PENDING job and dispatches the first keyword plus the first monitor check")
    void createDispatchesFirstKeyword() {
        CreateJobCommand command = new CreateJobCommand("owner-1", Platform.INSTAGRAM, List.of("fitness"), 100, true);
        when(keywordExpander.expand(Platform.INSTAGRAM, List.of("fitness"), 100, true))
                .thenReturn(List.of("fitness", "yoga", "pilates"));

        CreatedJob created = service.create(command, BASE_URL);

        assertThat(created.keywords()).containsExactly("fitness", "yoga", "pilates");
        assertThat(created.workersDispatched()).isEqualTo(1);

        ArgumentCaptor<DiscoveryJob> saved = ArgumentCaptor.forClass(DiscoveryJob.class);
        verify(jobRepository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(saved.getValue().getTimeoutAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(saved.getValue().getId()).isEqualTo(created.jobId());

        ArgumentCaptor<SearchWorkerMessage> search = ArgumentCaptor.forClass(SearchWorkerMessage.class);
        verify(dispatcher).dispatchSearch(eq(BASE_URL), search.capture());
        assertThat(search.getValue().keyword()).isEqualTo("fitness");
        assertThat(search.getValue().batchIndex()).isZero();
        assertThat(search.getValue().totalKeywords()).isEqualTo(3);
        verify(dispatcher).dispatchMonitor(BASE_URL, new MonitorMessage(created.jobId(), 0));
    }

    @Test
    @DisplayName("a queue outage at creation fails the job and propagates")
    void createFailsJobWhenQueueDown() {
        when(keywordExpander.expand(any(), any(), eq(100), eq(false))).thenReturn(List.of("fitness"));
        when(dispatcher.dispatchSearch(anyString(), any())).thenThrow(new QueuePublishException("qstash 500"));

        assertThatThrownBy(() -> service.create(
                new CreateJobCommand("owner-1", Platform.TIKTOK, List.of("fitness"), 100, false), BASE_URL))
                .isInstanceOf(QueuePublishException.class);
        verify(stateMachine).fail(anyString(), eq("Failed to dispatch workers: qstash 500"));
        verify(dispatcher, never()).dispatchMonitor(any(), any());
    }

    @Test
    @DisplayName("results clamp the page size")
    void resultsClampLimit() {
        when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job(JobStatus.PROCESSING, List.of("a"), 100)));
        when(creatorStore.page(JOB_ID, 0, DiscoveryJobService.MAX_PAGE_SIZE)).thenReturn(List.of());
        when(creatorStore.count(JOB_ID)).thenReturn(0L);

        JobResultsPage page = service.results(JOB_ID, -5, 10_000).orElseThrow();

        assertThat(page.offset()).isZero();
        assertThat(page.limit()).isEqualTo(DiscoveryJobService.MAX_PAGE_SIZE);
    }

    @Test
    @DisplayName("delete cascades to creators and result batches")
    void deleteCascades() {
        when(jobRepository.existsById(JOB_ID)).thenReturn(true);

        assertThat(service.delete(JOB_ID)).isTrue();
        verify(creatorStore).deleteByJob(JOB_ID);
        verify(resultBatchRepository).deleteByJobId(JOB_ID);
        verify(jobRepository).deleteById(JOB_ID);
    }

    @Test
    void deleteUnknownJob() {
        when(jobRepository.existsById(JOB_ID)).thenReturn(false);

        assertThat(service.delete(JOB_ID)).isFalse();
        verify(jobRepository, never()).deleteById(any());
    }
}
