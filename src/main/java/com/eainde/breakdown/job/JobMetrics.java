package com.eainde.breakdown.job;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * @param counts        jobs per status
 * @param queueLength   ids waiting in the queue
 * @param activeJobs    jobs processing
 * @param maxConcurrent processing cap
 * @param cacheEntries  cache entries younger than the TTL
 */
public record JobMetrics(
        @JsonProperty("counts")         Map<JobStatus, Integer> counts,
        @JsonProperty("queue_length")   int queueLength,
        @JsonProperty("active_jobs")    int activeJobs,
        @JsonProperty("max_concurrent") int maxConcurrent,
        @JsonProperty("cache_entries")  int cacheEntries
) {

    public JobMetrics {
        EnumMap<JobStatus, Integer> copy = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            copy.put(status, counts == null ? 0 : counts.getOrDefault(status, 0));
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public int count(JobStatus status) {
        return counts.get(status);
    }
}
