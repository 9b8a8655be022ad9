package com.eainde.breakdown.analyzer;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the analyzer registered for each {@link AnalyzerKind}.
 *
 * <p>Spring injects every {@link SceneAnalyzer} bean. Construction fails if a kind
 * is registered twice or not at all.</p>
 */
@Component
public class AnalyzerRegistry {

    private final Map<AnalyzerKind, SceneAnalyzer<?>> analyzers;

    public AnalyzerRegistry(List<SceneAnalyzer<?>> all) {
        Map<AnalyzerKind, SceneAnalyzer<?>> byKind = new EnumMap<>(AnalyzerKind.class);
        for (SceneAnalyzer<?> analyzer : all) {
            SceneAnalyzer<?> previous = byKind.put(analyzer.kind(), analyzer);
            if (previous != null) {
                throw new IllegalStateException("Two analyzers registered for " + analyzer.kind() + ": "
                        + previous.getClass().getSimpleName() + " and " + analyzer.getClass().getSimpleName());
            }
        }
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            if (!byKind.containsKey(kind)) {
                throw new IllegalStateException("No analyzer registered for " + kind);
            }
        }
        this.analyzers = Collections.unmodifiableMap(byKind);
    }

    @SuppressWarnings("unchecked")
    public <R> SceneAnalyzer<R> get(AnalyzerKind kind) {
        return (SceneAnalyzer<R>) analyzers.get(kind);
    }

    public int size() {
        return analyzers.size();
    }
}
