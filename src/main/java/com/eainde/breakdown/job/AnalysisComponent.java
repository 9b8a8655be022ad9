package com.eainde.breakdown.job;

import com.eainde.breakdown.analyzer.AnalyzerKind;
import com.eainde.breakdown.workflow.PipelineOptions;

import java.util.EnumSet;
import java.util.Set;

/**
 * What an analysis request asks for. Each component runs the pipeline with a subset of
 * the analyzers; the cast analyzer is always part of it.
 */
public enum AnalysisComponent {
    FULL_ANALYSIS(EnumSet.allOf(AnalyzerKind.class)),
    SEMANTIC_SYNOPSIS(EnumSet.of(AnalyzerKind.SYNOPSIS)),
    PROP_CLASSIFICATION(EnumSet.of(AnalyzerKind.PROPS)),
    WARDROBE_INFERENCE(EnumSet.of(AnalyzerKind.WARDROBE)),
    CINEMATIC_PATTERNS(EnumSet.of(AnalyzerKind.CINEMATIC)),
    LEGAL_SCAN(EnumSet.of(AnalyzerKind.LEGAL)),
    EFFECTS(EnumSet.of(AnalyzerKind.EFFECTS)),
    CONTINUITY_CHECK(EnumSet.of(AnalyzerKind.PROPS));

    private final Set<AnalyzerKind> analyzers;

    AnalysisComponent(Set<AnalyzerKind> analyzers) {
        this.analyzers = analyzers;
    }

    public PipelineOptions options() {
        return new PipelineOptions(analyzers);
    }
}
