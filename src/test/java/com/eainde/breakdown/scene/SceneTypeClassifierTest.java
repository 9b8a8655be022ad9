package com.eainde.breakdown.scene;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SceneTypeClassifierTest {

    private final SceneTypeClassifier classifier = new SceneTypeClassifier();

    @Test
    @DisplayName("mostly dialogue without conflict is DIALOGUE_HEAVY")
    void dialogueHeavy() {
        assertThat(classifier.classify("Scene 1 INT DAY OFFICE\nJOHN: Hello there.\nMARY: Hi."))
                .isEqualTo(SceneType.DIALOGUE_HEAVY);
    }

    @Test
    @DisplayName("mostly dialogue with conflict words is CONFRONTATION")
    void confrontation() {
        assertThat(classifier.classify("Scene 1 INT DAY OFFICE\nJOHN: You always argue with me.\nMARY: No."))
                .isEqualTo(SceneType.CONFRONTATION);
    }

    @Test
    @DisplayName("the header line does not count towards the dialogue ratio")
    void headerExcluded() {
        assertThat(classifier.classify("OFFICE: NIGHT SHIFT\nThe room is empty."))
                .isEqualTo(SceneType.TRANSITIONAL);
    }

    @Test
    @DisplayName("a discovery verb makes DISCOVERY")
    void discovery() {
        assertThat(classifier.classify("Scene 2 INT DAY ROOM\nMary finds an envelope under the door."))
                .isEqualTo(SceneType.DISCOVERY);
        assertThat(classifier.classify("مشهد 2\nتجد نهال ظرفا على المكتب"))
                .isEqualTo(SceneType.DISCOVERY);
    }

    @Test
    @DisplayName("two distinct action verbs make ACTION")
    void action() {
        assertThat(classifier.classify("Scene 3 EXT DAY STREET\nJohn enters the square and runs to the car."))
                .isEqualTo(SceneType.ACTION);
    }

    @Test
    @DisplayName("a single action verb is not enough")
    void singleActionVerb() {
        assertThat(classifier.classify("Scene 3 EXT DAY STREET\nJohn enters the square."))
                .isEqualTo(SceneType.TRANSITIONAL);
    }

    @Test
    @DisplayName("an emotion word makes EMOTIONAL")
    void emotional() {
        assertThat(classifier.classify("Scene 4 INT NIGHT HOME\nShe looks worried."))
                .isEqualTo(SceneType.EMOTIONAL);
    }
}
