package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.knowledge.KnowledgeBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerRegistryTest {

    private static List<SceneAnalyzer<?>> allAnalyzers() {
        List<SceneAnalyzer<?>> all = new ArrayList<>();
        all.add(new CastAnalyzer());
        all.add(new PropClassifier());
        all.add(new WardrobeInferenceEngine());
        all.add(new EffectsAnalyzer());
        all.add(new LegalAlertScanner(KnowledgeBase.empty()));
        all.add(new CinematicPatternMatcher());
        all.add(new SynopsisGenerator());
        return all;
    }

    @Test
    @DisplayName("one analyzer per kind")
    void registersEveryKind() {
        AnalyzerRegistry registry = new AnalyzerRegistry(allAnalyzers());

        assertThat(registry.size()).isEqualTo(AnalyzerKind.values().length);
        assertThat(registry.<Object>get(AnalyzerKind.PROPS)).isInstanceOf(PropClassifier.class);
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            assertThat(registry.<Object>get(kind).kind()).isEqualTo(kind);
        }
    }

    @Test
    @DisplayName("a kind registered twice is rejected")
    void duplicateKind() {
        List<SceneAnalyzer<?>> all = allAnalyzers();
        all.add(new EffectsAnalyzer());

        assertThatThrownBy(() -> new AnalyzerRegistry(all))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("EFFECTS");
    }

    @Test
    @DisplayName("a missing kind is rejected")
    void missingKind() {
        List<SceneAnalyzer<?>> all = allAnalyzers();
        all.removeIf(a -> a.kind() == AnalyzerKind.SYNOPSIS);

        assertThatThrownBy(() -> new AnalyzerRegistry(all))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SYNOPSIS");
    }
}
