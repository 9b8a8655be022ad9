package com.eainde.breakdown.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A job as listed by {@link JobManager#listJobs}, without its text or result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSummary(
        @JsonProperty("job_id")      String jobId,
        @JsonProperty("status")      JobStatus status,
        @JsonProperty("component")   AnalysisComponent component,
        @JsonProperty("priority")    JobPriority priority,
        @JsonProperty("created_at")  Instant createdAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("from_cache")  boolean fromCache
) {

    static JobSummary of(AnalysisJob job) {
        return new JobSummary(job.getId(), job.getStatus(), job.getComponent(), job.getPriority(),
                job.getCreatedAt(), job.getFinishedAt(), job.isFromCache());
    }
}
