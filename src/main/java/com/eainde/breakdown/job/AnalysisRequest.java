package com.eainde.breakdown.job;

import lombok.Builder;

import java.util.Objects;

/**
 * One request for analysis. Unset fields take their defaults: full analysis, normal
 * priority, cached results, confidence threshold 0.7.
 *
 * @param text                the script text
 * @param component           what to analyse
 * @param priority            queue priority
 * @param cacheResults        whether a cached result may be served and the result cached
 * @param confidenceThreshold part of the cache key, between 0 and 1
 */
@Builder
public record AnalysisRequest(
        String text,
        AnalysisComponent component,
        JobPriority priority,
        Boolean cacheResults,
        Double confidenceThreshold
) {

    public static final double DEFAULT_THRESHOLD = 0.7;

    public AnalysisRequest {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Analysis text must not be blank");
        }
        component = component == null ? AnalysisComponent.FULL_ANALYSIS : component;
        priority = priority == null ? JobPriority.NORMAL : priority;
        cacheResults = cacheResults == null ? Boolean.TRUE : cacheResults;
        confidenceThreshold = confidenceThreshold == null ? DEFAULT_THRESHOLD : confidenceThreshold;
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("Confidence threshold must be between 0 and 1, got " + confidenceThreshold);
        }
    }
}
