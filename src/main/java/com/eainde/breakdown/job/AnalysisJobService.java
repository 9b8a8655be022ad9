package com.eainde.breakdown.job;

import com.eainde.breakdown.model.ScriptBreakdown;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Front door for analysis jobs: submit, poll, fetch, cancel.
 *
 * <p>Jobs run on the job worker pool. A dispatch attempt is made on every submission and
 * whenever a job finishes; the {@link JobManager} never hands out more than its
 * processing cap, so nothing waits on a busy loop.</p>
 */
@Log4j2
@Service
public class AnalysisJobService {

    static final String MDC_JOB_ID = "jobId";

    private final JobManager jobManager;
    private final JobProcessor processor;
    private final Executor jobExecutor;

    public AnalysisJobService(JobManager jobManager,
                              JobProcessor processor,
                              @Qualifier("jobExecutor") Executor jobExecutor) {
        this.jobManager = jobManager;
        this.processor = processor;
        this.jobExecutor = jobExecutor;
    }

    public String submit(String text, AnalysisComponent component, JobPriority priority, boolean cacheResults) {
        return submit(AnalysisRequest.builder()
                .text(text)
                .component(component)
                .priority(priority)
                .cacheResults(cacheResults)
                .build());
    }

    public String submit(AnalysisRequest request) {
        String jobId = jobManager.submit(request);
        dispatch();
        return jobId;
    }

    public JobStatusView getStatus(String jobId) {
        return jobManager.getStatus(jobId);
    }

    public JobResult getResult(String jobId) {
        return jobManager.getResult(jobId);
    }

    public boolean cancel(String jobId) {
        return jobManager.cancel(jobId);
    }

    public List<JobSummary> listJobs(JobStatus status, int limit) {
        return jobManager.listJobs(status, limit);
    }

    public JobMetrics metrics() {
        return jobManager.metrics();
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private void dispatch() {
        Optional<AnalysisJob> next;
        while ((next = jobManager.claimNext()).isPresent()) {
            AnalysisJob job = next.get();
            try {
                jobExecutor.execute(() -> run(job));
            } catch (RejectedExecutionException e) {
                log.error("Job {} could not be scheduled: {}", job.getId(), e.getMessage());
                jobManager.fail(job.getId(), "Job could not be scheduled: " + e.getMessage());
            }
        }
    }

    private void run(AnalysisJob job) {
        MDC.put(MDC_JOB_ID, job.getId());
        try {
            log.info("Job {} started: {}", job.getId(), job.getComponent());
            ScriptBreakdown result = processor.process(job.getRequest());
            jobManager.complete(job.getId(), result);
            log.info("Job {} completed: {} scenes, {} skipped",
                    job.getId(), result.successCount(), result.failureCount());
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Job {} failed: {}", job.getId(), message, e);
            jobManager.fail(job.getId(), message);
        } catch (Error e) {
            // free the slot before the error leaves the worker
            log.error("Job {} aborted: {}", job.getId(), e.toString(), e);
            jobManager.fail(job.getId(), "Job aborted: " + e);
            throw e;
        } finally {
            MDC.remove(MDC_JOB_ID);
            dispatch();
        }
    }
}
