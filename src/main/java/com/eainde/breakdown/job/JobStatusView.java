package com.eainde.breakdown.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param queuePosition 1-based position while pending, otherwise null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusView(
        @JsonProperty("job_id")         String jobId,
        @JsonProperty("status")         JobStatus status,
        @JsonProperty("queue_position") Integer queuePosition
) {
}
