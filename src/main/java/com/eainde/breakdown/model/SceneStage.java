package com.eainde.breakdown.model;

/**
 * Lifecycle of one scene through the pipeline: extracted, enriched, refined.
 * FAILED is terminal and only reachable from extraction.
 */
public enum SceneStage {
    EXTRACTED,
    ENRICHED,
    REFINED,
    FAILED
}
