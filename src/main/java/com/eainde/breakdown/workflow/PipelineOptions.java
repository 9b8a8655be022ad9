package com.eainde.breakdown.workflow;

import com.eainde.breakdown.analyzer.AnalyzerKind;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Analyzers enabled for one run. The cast analyzer is always enabled: wardrobe
 * inference and continuity tracking depend on it.
 *
 * @param enabled enabled analyzer kinds
 */
public record PipelineOptions(Set<AnalyzerKind> enabled) implements Serializable {

    public PipelineOptions {
        EnumSet<AnalyzerKind> copy = EnumSet.of(AnalyzerKind.CAST);
        if (enabled != null) {
            copy.addAll(enabled);
        }
        enabled = Collections.unmodifiableSet(copy);
    }

    public static PipelineOptions all() {
        return new PipelineOptions(EnumSet.allOf(AnalyzerKind.class));
    }

    public static PipelineOptions of(AnalyzerKind... kinds) {
        EnumSet<AnalyzerKind> set = EnumSet.noneOf(AnalyzerKind.class);
        Collections.addAll(set, kinds);
        return new PipelineOptions(set);
    }

    public boolean isEnabled(AnalyzerKind kind) {
        return enabled.contains(kind);
    }

    public PipelineOptions without(AnalyzerKind kind) {
        EnumSet<AnalyzerKind> copy = EnumSet.copyOf(enabled);
        copy.remove(kind);
        return new PipelineOptions(copy);
    }

    public PipelineOptions retain(Collection<AnalyzerKind> kinds) {
        EnumSet<AnalyzerKind> copy = EnumSet.copyOf(enabled);
        copy.retainAll(kinds);
        return new PipelineOptions(copy);
    }
}
