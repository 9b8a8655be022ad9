package com.eainde.breakdown.workflow;

import com.eainde.breakdown.analyzer.AnalyzerKind;

/**
 * Deployment-wide pipeline switches, read once from configuration.
 *
 * @param sceneBatchSize   scenes extracted and enriched concurrently
 * @param wardrobeInference false disables the wardrobe analyzer for every run
 * @param legalAlerts      false disables the legal scanner for every run
 */
public record PipelineSettings(int sceneBatchSize, boolean wardrobeInference, boolean legalAlerts) {

    public PipelineSettings {
        if (sceneBatchSize < 1) {
            throw new IllegalArgumentException("sceneBatchSize must be positive, got " + sceneBatchSize);
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(8, true, true);
    }

    public PipelineOptions defaultOptions() {
        return restrict(PipelineOptions.all());
    }

    /**
     * @return the requested options minus whatever these settings switch off
     */
    public PipelineOptions restrict(PipelineOptions requested) {
        PipelineOptions options = requested;
        if (!wardrobeInference) options = options.without(AnalyzerKind.WARDROBE);
        if (!legalAlerts) options = options.without(AnalyzerKind.LEGAL);
        return options;
    }
}
