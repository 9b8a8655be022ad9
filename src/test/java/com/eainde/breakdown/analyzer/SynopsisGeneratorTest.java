package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.scene.InteriorExterior;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;
import com.eainde.breakdown.scene.TimeOfDay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SynopsisGeneratorTest {

    private static final SceneHeader OFFICE = new SceneHeader(InteriorExterior.INT, TimeOfDay.DAY, "OFFICE");
    private static final SceneHeader STREET = new SceneHeader(InteriorExterior.EXT, TimeOfDay.NIGHT, "STREET");

    private final SynopsisGenerator generator = new SynopsisGenerator();

    // =========================================================================
    //  Templates
    // =========================================================================

    @Nested
    @DisplayName("Templates")
    class Templates {

        @Test
        @DisplayName("two characters discuss the topic of the first long line of dialogue")
        void dialogueTwoCharacters() {
            String text = "Scene 1 INT DAY OFFICE\nJOHN: We need to talk about the film tomorrow.\nMARY: Fine.";

            String synopsis = generator.generate(text, SceneType.DIALOGUE_HEAVY, List.of("JOHN", "MARY"), OFFICE);

            assertThat(synopsis).isEqualTo("JOHN and MARY discuss career prospects.");
        }

        @Test
        @DisplayName("the next template is used when a placeholder has no value")
        void secondTemplate() {
            String text = "Scene 1 INT DAY OFFICE\nJOHN: I have been thinking about us lately.";

            String synopsis = generator.generate(text, SceneType.DIALOGUE_HEAVY, List.of("JOHN"), OFFICE);

            assertThat(synopsis).isEqualTo("JOHN talks about a private matter.");
        }

        @Test
        @DisplayName("action verbs and the lower-cased location")
        void action() {
            String text = "Scene 2 EXT NIGHT STREET\nJOHN enters the street and runs.";

            String synopsis = generator.generate(text, SceneType.ACTION, List.of("JOHN"), STREET);

            assertThat(synopsis).isEqualTo("JOHN enters in the street.");
        }

        @Test
        @DisplayName("a mostly Arabic scene uses the Arabic templates")
        void arabic() {
            SceneHeader home = new SceneHeader(InteriorExterior.INT, TimeOfDay.NIGHT, "منزل");
            String text = "مشهد 1 داخلي ليل منزل\nيدخل كريم إلى المنزل";

            String synopsis = generator.generate(text, SceneType.ACTION, List.of("كريم"), home);

            assertThat(synopsis).isEqualTo("كريم يدخل في منزل.");
        }

        @Test
        @DisplayName("every scene type has English and Arabic templates")
        void templatesForEveryType() {
            assertThat(generator.templates(false)).containsOnlyKeys(SceneType.values());
            assertThat(generator.templates(true)).containsOnlyKeys(SceneType.values());
        }
    }

    // =========================================================================
    //  Excerpt fallback
    // =========================================================================

    @Nested
    @DisplayName("Excerpt fallback")
    class Excerpt {

        @Test
        @DisplayName("narrative lines are used when no template fits")
        void narrativeExcerpt() {
            String text = "Scene 9\nThe camera pans slowly across the empty harbour at dawn.";

            String synopsis = generator.generate(text, SceneType.TRANSITIONAL, List.of(), SceneHeader.defaults());

            assertThat(synopsis).isEqualTo("The camera pans slowly across the empty harbour at dawn.");
        }

        @Test
        @DisplayName("dialogue and short lines are skipped")
        void skipsDialogueAndShortLines() {
            assertThat(SynopsisGenerator.excerpt("Scene 9\nJOHN: This is a long line of dialogue.\nShort.\nA long narrative line follows here."))
                    .isEqualTo("A long narrative line follows here.");
        }

        @Test
        @DisplayName("nothing usable gives the unavailable marker")
        void unavailable() {
            String synopsis = generator.generate("Scene 9\nShort.", SceneType.TRANSITIONAL, List.of(),
                    SceneHeader.defaults());

            assertThat(synopsis).isEqualTo(SynopsisGenerator.UNAVAILABLE);
        }
    }

    @Test
    @DisplayName("refine capitalises, terminates and caps the length")
    void refine() {
        assertThat(SynopsisGenerator.refine("  hello there ")).isEqualTo("Hello there.");
        assertThat(SynopsisGenerator.refine("Really?")).isEqualTo("Really?");

        String refined = SynopsisGenerator.refine("a".repeat(300));
        assertThat(refined).hasSize(SynopsisGenerator.MAX_LENGTH).endsWith("...");
    }
}
