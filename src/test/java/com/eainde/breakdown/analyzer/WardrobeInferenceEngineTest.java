package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.exception.AnalyzerException;
import com.eainde.breakdown.knowledge.KnowledgeBase;
import com.eainde.breakdown.knowledge.ProfileRegistry;
import com.eainde.breakdown.model.CastResult;
import com.eainde.breakdown.model.CharacterProfile;
import com.eainde.breakdown.model.WardrobeResult;
import com.eainde.breakdown.scene.InteriorExterior;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;
import com.eainde.breakdown.scene.TimeOfDay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WardrobeInferenceEngineTest {

    private static final SceneHeader DAY_OFFICE = new SceneHeader(InteriorExterior.INT, TimeOfDay.DAY, "OFFICE");
    private static final SceneHeader VILLA = new SceneHeader(InteriorExterior.INT, TimeOfDay.DAY, "VILLA");

    private static final CharacterProfile DETECTIVE = new CharacterProfile(
            "Mark Hale", null, List.of(), "male", "40s", "detective", "middle", null);
    private static final CharacterProfile PARALYSED = new CharacterProfile(
            "Raafat", null, List.of(), "male", "40s", null, "upper", "paralyzed");

    private final WardrobeInferenceEngine engine = new WardrobeInferenceEngine();

    // =========================================================================
    //  infer
    // =========================================================================

    @Nested
    @DisplayName("infer")
    class Infer {

        @Test
        @DisplayName("time and location alone")
        void timeAndLocation() {
            String description = engine.infer(CharacterProfile.synthesized("JOHN"), "Scene 1\nJOHN: Hello.", DAY_OFFICE);

            assertThat(description).isEqualTo("formal business attire");
        }

        @Test
        @DisplayName("elements whose concept words were all said are dropped")
        void mergesConcepts() {
            String description = engine.infer(DETECTIVE, "Scene 1\nHALE looks stern.", DAY_OFFICE);

            assertThat(description).isEqualTo(
                    "formal conservative attire (suit or tailored two-piece)"
                            + " | plain-clothes suit with holstered sidearm");
        }

        @Test
        @DisplayName("upper class in a villa and illness add their own elements")
        void classAndIllness() {
            String description = engine.infer(PARALYSED, "Scene 1\nQuiet.", VILLA);

            assertThat(description).contains("upscale clothes matching social class")
                    .contains("luxury high-end clothing")
                    .contains("upscale homewear (robe or luxury pajamas)");
        }

        @Test
        @DisplayName("elements without a shared concept word survive a shared first word")
        void unrelatedElementsKept() {
            SceneHeader hospital = new SceneHeader(InteriorExterior.INT, TimeOfDay.DAY, "HOSPITAL");

            String description = engine.infer(CharacterProfile.synthesized("NOUR"), "Scene 4\nNOUR is practical.", hospital);

            assertThat(description).isEqualTo(
                    "plain practical style with minimal accessories"
                            + " | plain clothes suited to a hospital visit");
        }

        @Test
        @DisplayName("a repeated homewear element is said once")
        void homewearOnce() {
            SceneHeader nightRoom = new SceneHeader(InteriorExterior.INT, TimeOfDay.NIGHT, "BEDROOM");

            String description = engine.infer(CharacterProfile.synthesized("RAAFAT"),
                    "Scene 2\nRAAFAT sits paralyzed.", nightRoom);

            assertThat(description).isEqualTo("upscale homewear or a comfortable robe");
        }

        @Test
        @DisplayName("no rule firing is context-dependent")
        void contextDependent() {
            String description = engine.infer(CharacterProfile.synthesized("JOHN"), "Scene 1\nNothing.",
                    SceneHeader.defaults());

            assertThat(description).isEqualTo(WardrobeInferenceEngine.CONTEXT_DEPENDENT);
        }
    }

    // =========================================================================
    //  analyze
    // =========================================================================

    @Nested
    @DisplayName("analyze")
    class Analyze {

        private SceneContext contextWith(CharacterProfile... cast) {
            Map<String, CharacterProfile> profiles = new LinkedHashMap<>();
            for (CharacterProfile p : cast) {
                profiles.put(p.canonicalName(), p);
            }
            CastResult result = new CastResult(List.copyOf(profiles.keySet()), profiles, CastResult.NO_EXTRAS);
            return SceneContext.of(DAY_OFFICE, SceneType.TRANSITIONAL, List.of(),
                    new ProfileRegistry(KnowledgeBase.empty())).withCast(result);
        }

        @Test
        @DisplayName("one spec per cast member, in cast order")
        void specPerCastMember() {
            SceneBlock scene = new SceneBlock("1", "Scene 1 INT DAY OFFICE\nHALE: Sit down.");

            WardrobeResult result = engine.analyze(scene, contextWith(DETECTIVE, PARALYSED));

            assertThat(result.specs()).extracting(s -> s.character()).containsExactly("Mark Hale", "Raafat");
            assertThat(result.specs()).allMatch(s -> s.inferred());
            assertThat(result.makeup()).containsExactly(
                    "Mark Hale: standard camera-ready correction",
                    "Raafat: pale, tired complexion");
        }

        @Test
        @DisplayName("injuries add a scene-level make-up note")
        void injuryMakeup() {
            SceneBlock scene = new SceneBlock("1", "Scene 1 INT DAY OFFICE\nHALE wipes the blood from his lip.");

            WardrobeResult result = engine.analyze(scene, contextWith(DETECTIVE));

            assertThat(result.makeup()).contains("Scene: wound and injury effects required");
        }

        @Test
        @DisplayName("without the cast result the analyzer fails")
        void requiresCast() {
            SceneBlock scene = new SceneBlock("4", "Scene 4");
            SceneContext context = SceneContext.of(DAY_OFFICE, SceneType.TRANSITIONAL, List.of(),
                    new ProfileRegistry(KnowledgeBase.empty()));

            assertThatThrownBy(() -> engine.analyze(scene, context))
                    .isInstanceOf(AnalyzerException.class)
                    .hasMessageContaining("scene 4");
        }
    }
}
