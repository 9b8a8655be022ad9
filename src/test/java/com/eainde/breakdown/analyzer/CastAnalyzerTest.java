package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.knowledge.KnowledgeBase;
import com.eainde.breakdown.knowledge.ProfileRegistry;
import com.eainde.breakdown.model.CastResult;
import com.eainde.breakdown.model.CharacterProfile;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CastAnalyzerTest {

    private static final CharacterProfile HALE = new CharacterProfile(
            "Mark Hale", null, List.of("MARK", "HALE"), "male", "40s", "detective", "middle", null);

    private final CastAnalyzer analyzer = new CastAnalyzer();
    private ProfileRegistry profiles;

    @BeforeEach
    void setUp() {
        profiles = new ProfileRegistry(new KnowledgeBase(List.of(HALE), Set.of(), Set.of(), Set.of()));
    }

    private SceneContext context(List<String> rawCast) {
        return SceneContext.of(SceneHeader.defaults(), SceneType.TRANSITIONAL, rawCast, profiles);
    }

    // =========================================================================
    //  Name extraction
    // =========================================================================

    @Nested
    @DisplayName("extractNames")
    class ExtractNames {

        @Test
        @DisplayName("dialogue cues first, then stage directions, without duplicates")
        void cuesThenDirections() {
            String text = "Scene 1 INT DAY OFFICE\nJOHN: Hello.\nMARY: Hi.\nPETER enters.\nJOHN: Again.";

            assertThat(analyzer.extractNames(text)).containsExactly("JOHN", "MARY", "PETER");
        }

        @Test
        @DisplayName("reserved words are not characters")
        void reservedWords() {
            String text = "Scene 1\nNOTE: check the lights.\nJOHN: Hi.";

            assertThat(analyzer.extractNames(text)).containsExactly("JOHN");
        }

        @Test
        @DisplayName("names longer than three words are rejected")
        void tooLong() {
            String text = "Scene 1\nTHE MAN IN BLACK: Stop.\nJOHN: Why?";

            assertThat(analyzer.extractNames(text)).containsExactly("JOHN");
        }

        @Test
        @DisplayName("Arabic stage directions put the name after the verb")
        void arabicDirections() {
            assertThat(analyzer.extractNames("مشهد 1\nيدخل كريم إلى المكتب")).containsExactly("كريم");
            assertThat(analyzer.extractNames("مشهد 1\nيدخل إلى المكتب")).isEmpty();
        }

        @Test
        @DisplayName("the header line is never read for names")
        void headerSkipped() {
            assertThat(analyzer.extractNames("Scene 1 INT DAY OFFICE")).isEmpty();
        }
    }

    // =========================================================================
    //  Canonicalisation
    // =========================================================================

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("aliases collapse onto the knowledge-base name")
        void aliasesCollapse() {
            SceneBlock scene = new SceneBlock("1", "Scene 1\nMARK: Hi.\nHALE: It's me.\nJOHN: Who?");

            CastResult result = analyzer.analyze(scene, context(List.of("MARK", "HALE", "JOHN")));

            assertThat(result.cast()).containsExactly("Mark Hale", "JOHN");
            assertThat(result.profiles().get("Mark Hale").profession()).isEqualTo("detective");
            assertThat(result.profiles().get("JOHN").profession()).isNull();
            assertThat(result.extrasNote()).isEqualTo(CastResult.NO_EXTRAS);
        }

        @Test
        @DisplayName("names are extracted from the text when the context has none")
        void extractsWhenContextEmpty() {
            SceneBlock scene = new SceneBlock("1", "Scene 1\nMARK: Hi.");

            assertThat(analyzer.analyze(scene, context(List.of())).cast()).containsExactly("Mark Hale");
        }

        @Test
        @DisplayName("crowd words ask for background extras")
        void crowd() {
            SceneBlock scene = new SceneBlock("1", "Scene 1 EXT DAY STREET\nA crowd gathers.\nJOHN: Move!");

            assertThat(analyzer.analyze(scene, context(List.of("JOHN"))).extrasNote())
                    .isEqualTo(CastAnalyzer.CROWD_NOTE);
        }

        @Test
        @DisplayName("the fallback keeps the raw names as the cast")
        void fallback() {
            SceneBlock scene = new SceneBlock("1", "Scene 1");

            CastResult result = analyzer.fallback(scene, context(List.of("JOHN", "JOHN", "MARY")));

            assertThat(result.cast()).containsExactly("JOHN", "MARY");
        }
    }
}
