package com.eainde.breakdown.workflow;

import com.eainde.breakdown.analyzer.AnalyzerKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineOptionsTest {

    @Test
    @DisplayName("the cast analyzer is always enabled")
    void castAlwaysOn() {
        assertThat(PipelineOptions.of().enabled()).containsExactly(AnalyzerKind.CAST);
        assertThat(PipelineOptions.all().without(AnalyzerKind.CAST).isEnabled(AnalyzerKind.CAST)).isTrue();
        assertThat(new PipelineOptions(null).enabled()).containsExactly(AnalyzerKind.CAST);
    }

    @Test
    @DisplayName("without and retain narrow the set")
    void narrowing() {
        PipelineOptions options = PipelineOptions.all()
                .without(AnalyzerKind.LEGAL)
                .retain(List.of(AnalyzerKind.LEGAL, AnalyzerKind.PROPS, AnalyzerKind.SYNOPSIS));

        assertThat(options.enabled()).containsExactlyInAnyOrder(
                AnalyzerKind.CAST, AnalyzerKind.PROPS, AnalyzerKind.SYNOPSIS);
    }

    @Test
    @DisplayName("the enabled set cannot be modified")
    void unmodifiable() {
        PipelineOptions options = new PipelineOptions(EnumSet.of(AnalyzerKind.PROPS));

        assertThatThrownBy(() -> options.enabled().add(AnalyzerKind.LEGAL))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("settings switch analyzers off for every run")
    void settingsRestrict() {
        PipelineSettings settings = new PipelineSettings(4, false, false);

        assertThat(settings.defaultOptions().isEnabled(AnalyzerKind.WARDROBE)).isFalse();
        assertThat(settings.defaultOptions().isEnabled(AnalyzerKind.LEGAL)).isFalse();
        assertThat(settings.restrict(PipelineOptions.of(AnalyzerKind.PROPS)).enabled())
                .containsExactlyInAnyOrder(AnalyzerKind.CAST, AnalyzerKind.PROPS);
        assertThat(PipelineSettings.defaults().defaultOptions()).isEqualTo(PipelineOptions.all());
    }

    @Test
    @DisplayName("the batch size must be positive")
    void batchSize() {
        assertThatThrownBy(() -> new PipelineSettings(0, true, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
