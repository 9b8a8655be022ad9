package com.eainde.breakdown.job;

import com.eainde.breakdown.model.ScriptBreakdown;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a job: the breakdown once completed, the error once failed, neither before.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResult(
        @JsonProperty("job_id")     String jobId,
        @JsonProperty("status")     JobStatus status,
        @JsonProperty("result")     ScriptBreakdown result,
        @JsonProperty("error")      String error,
        @JsonProperty("from_cache") boolean fromCache
) {
}
