package com.eainde.breakdown.pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TermSetTest {

    // =========================================================================
    //  Matching
    // =========================================================================

    @Nested
    @DisplayName("foundIn")
    class FoundIn {

        @Test
        @DisplayName("Latin terms do not match inside longer words")
        void latinBounded() {
            TermSet cars = TermSet.of("cars?");

            assertThat(cars.foundIn("He drops a card.")).isFalse();
            assertThat(cars.foundIn("He parks the CAR.")).isTrue();
            assertThat(cars.foundIn("Two cars collide")).isTrue();
        }

        @Test
        @DisplayName("Arabic terms match with attached prefixes")
        void arabicSubstring() {
            TermSet night = TermSet.of("ليل");

            assertThat(night.foundIn("في الليل")).isTrue();
        }

        @Test
        @DisplayName("null text never matches")
        void nullText() {
            assertThat(TermSet.of("night").foundIn(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("countIn / firstIn / findAll")
    class Extraction {

        @Test
        @DisplayName("countIn counts distinct terms, not occurrences")
        void countDistinct() {
            TermSet time = TermSet.of("night", "evening", "dusk");

            assertThat(time.countIn("night, night and evening")).isEqualTo(2);
            assertThat(time.countIn(null)).isZero();
        }

        @Test
        @DisplayName("firstIn follows declaration order and lower-cases Latin hits")
        void firstInDeclarationOrder() {
            TermSet time = TermSet.of("night", "evening");

            assertThat(time.firstIn("EVENING turns to NIGHT")).contains("night");
            assertThat(time.firstIn("noon")).isEmpty();
        }

        @Test
        @DisplayName("findAll returns hits in text order without duplicates")
        void findAllInTextOrder() {
            TermSet vehicles = TermSet.of("cars?", "bus");

            assertThat(vehicles.findAll("Bus, car and another CAR")).containsExactly("bus", "car");
        }
    }

    @Nested
    @DisplayName("matchesToken")
    class MatchesToken {

        @Test
        @DisplayName("the whole token must equal a term")
        void wholeToken() {
            TermSet interior = TermSet.of("int\\.?", "interior");

            assertThat(interior.matchesToken("INT.")).isTrue();
            assertThat(interior.matchesToken(" interior ")).isTrue();
            assertThat(interior.matchesToken("internal")).isFalse();
            assertThat(interior.matchesToken("")).isFalse();
        }
    }

    @Test
    @DisplayName("an empty term set is rejected")
    void emptyRejected() {
        assertThatThrownBy(TermSet::of)
                .isInstanceOf(IllegalArgumentException.class);
    }
}
