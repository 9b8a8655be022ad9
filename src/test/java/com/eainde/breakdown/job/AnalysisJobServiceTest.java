package com.eainde.breakdown.job;

import com.eainde.breakdown.model.ScriptBreakdown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisJobServiceTest {

    private static final ScriptBreakdown RESULT = new ScriptBreakdown(List.of(), List.of(), 3);

    @Mock
    private JobProcessor processor;

    private JobManager manager;

    @BeforeEach
    void setUp() {
        manager = new JobManager(1, Duration.ofSeconds(3600), Clock.systemUTC());
    }

    @Test
    @DisplayName("a submitted job runs and completes")
    void completes() {
        when(processor.process(any())).thenReturn(RESULT);
        AnalysisJobService service = new AnalysisJobService(manager, processor, Runnable::run);

        String id = service.submit("Scene 1 INT DAY OFFICE", AnalysisComponent.FULL_ANALYSIS, JobPriority.HIGH, true);

        JobResult result = service.getResult(id);
        assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(result.result().totalScenes()).isEqualTo(3);
        assertThat(service.metrics().count(JobStatus.COMPLETED)).isEqualTo(1);
    }

    @Test
    @DisplayName("a processor exception fails the job with its message")
    void fails() {
        when(processor.process(any())).thenThrow(new IllegalStateException("no scenes"));
        AnalysisJobService service = new AnalysisJobService(manager, processor, Runnable::run);

        String id = service.submit("text", AnalysisComponent.LEGAL_SCAN, JobPriority.NORMAL, false);

        JobResult result = service.getResult(id);
        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(result.error()).isEqualTo("no scenes");
    }

    @Test
    @DisplayName("queued jobs wait for a free slot and can be cancelled meanwhile")
    void queuedAndCancelled() {
        when(processor.process(any())).thenReturn(RESULT);
        List<Runnable> scheduled = new ArrayList<>();
        Executor deferred = scheduled::add;
        AnalysisJobService service = new AnalysisJobService(manager, processor, deferred);

        String first = service.submit("first", AnalysisComponent.FULL_ANALYSIS, JobPriority.NORMAL, false);
        String second = service.submit("second", AnalysisComponent.FULL_ANALYSIS, JobPriority.NORMAL, false);
        String third = service.submit("third", AnalysisComponent.FULL_ANALYSIS, JobPriority.NORMAL, false);

        assertThat(service.getStatus(first).status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(service.getStatus(second).queuePosition()).isEqualTo(1);
        assertThat(service.cancel(second)).isTrue();
        assertThat(scheduled).hasSize(1);

        scheduled.get(0).run();

        assertThat(service.getStatus(first).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(service.getStatus(second).status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(service.getStatus(third).status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(scheduled).hasSize(2);
    }

    @Test
    @DisplayName("an error from the processor fails the job and frees its slot")
    void errorFreesSlot() {
        when(processor.process(any())).thenThrow(new StackOverflowError()).thenReturn(RESULT);
        List<Runnable> scheduled = new ArrayList<>();
        Executor deferred = scheduled::add;
        AnalysisJobService service = new AnalysisJobService(manager, processor, deferred);

        String first = service.submit("deep", AnalysisComponent.FULL_ANALYSIS, JobPriority.NORMAL, false);
        String second = service.submit("next", AnalysisComponent.FULL_ANALYSIS, JobPriority.NORMAL, false);

        assertThatThrownBy(() -> scheduled.get(0).run()).isInstanceOf(StackOverflowError.class);

        JobResult failed = service.getResult(first);
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.error()).contains("StackOverflowError");
        assertThat(service.getStatus(second).status()).isEqualTo(JobStatus.PROCESSING);

        scheduled.get(1).run();

        assertThat(service.getStatus(second).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("a job the pool rejects is failed")
    void rejected() {
        Executor full = command -> {
            throw new RejectedExecutionException("pool is shut down");
        };
        AnalysisJobService service = new AnalysisJobService(manager, processor, full);

        String id = service.submit("text", AnalysisComponent.EFFECTS, JobPriority.LOW, true);

        JobResult result = service.getResult(id);
        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(result.error()).contains("pool is shut down");
        verify(processor, never()).process(any());
    }
}
