package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.knowledge.KnowledgeBase;
import com.eainde.breakdown.knowledge.ProfileRegistry;
import com.eainde.breakdown.model.EffectsReport;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EffectsAnalyzerTest {

    private final EffectsAnalyzer analyzer = new EffectsAnalyzer();

    private EffectsReport analyze(String text) {
        return analyzer.analyze(new SceneBlock("1", text), SceneContext.of(SceneHeader.defaults(),
                SceneType.TRANSITIONAL, List.of(), new ProfileRegistry(KnowledgeBase.empty())));
    }

    @Test
    @DisplayName("cues are additive across categories")
    void additive() {
        EffectsReport report = analyze(
                "Scene 1 EXT NIGHT STREET\nRain falls. A car engine roars. An explosion lights the sky.");

        assertThat(report.specialEffects()).containsExactly("practical effects (explosion/smoke)", "weather effects");
        assertThat(report.visualEffects()).isEmpty();
        assertThat(report.sound()).containsExactly("vehicle sounds");
    }

    @Test
    @DisplayName("a dialogue cue in the body means live dialogue")
    void dialogueCue() {
        assertThat(analyze("Scene 2 INT DAY OFFICE\nJOHN: Hello.").sound()).containsExactly("live dialogue");
    }

    @Test
    @DisplayName("Arabic cues")
    void arabic() {
        EffectsReport report = analyze("مشهد 3\nصوت عمرو دياب يغني من الكاسيت وتظهر صورة على الشاشة");

        assertThat(report.sound()).contains("music");
        assertThat(report.visualEffects()).contains("screen content replacement (playback)");
    }

    @Test
    @DisplayName("a quiet scene needs nothing")
    void nothing() {
        EffectsReport report = analyze("Scene 4 INT DAY ROOM\nSilence.");

        assertThat(report.specialEffects()).isEmpty();
        assertThat(report.visualEffects()).isEmpty();
        assertThat(report.sound()).isEmpty();
    }
}
