package com.eainde.breakdown.pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptPatternsTest {

    @Test
    @DisplayName("scene markers are recognised in English and Arabic forms")
    void sceneMarkers() {
        assertThat(number("Scene 12 INT DAY OFFICE")).isEqualTo("12");
        assertThat(number("SC. 4 - EXT")).isEqualTo("4");
        assertThat(number("Scene #3")).isEqualTo("3");
        assertThat(number("مشهد ٥ داخلي")).isEqualTo("٥");
        assertThat(number("المشهد 7")).isEqualTo("7");
    }

    @Test
    @DisplayName("a marker must start the line")
    void markerAnchoredAtLineStart() {
        assertThat(ScriptPatterns.SCENE_MARKER.matcher("Back to Scene 4 later").find()).isFalse();
    }

    @Test
    @DisplayName("dialogue cues need a short name followed by a colon")
    void dialogueCues() {
        assertThat(ScriptPatterns.isDialogueCue("JOHN: Hello")).isTrue();
        assertThat(ScriptPatterns.isDialogueCue("كريم: أهلا")).isTrue();
        assertThat(ScriptPatterns.isDialogueCue("John walks in.")).isFalse();
    }

    @Test
    @DisplayName("language detection")
    void language() {
        assertThat(ScriptPatterns.isLatin("OFFICE")).isTrue();
        assertThat(ScriptPatterns.isLatin("مكتب OFFICE")).isFalse();
        assertThat(ScriptPatterns.isMostlyArabic("يدخل كريم to the office")).isFalse();
        assertThat(ScriptPatterns.isMostlyArabic("يدخل كريم إلى المكتب JOHN")).isTrue();
        assertThat(ScriptPatterns.isMostlyArabic(null)).isFalse();
    }

    @Test
    @DisplayName("helpers collapse whitespace and drop blank lines")
    void helpers() {
        assertThat(ScriptPatterns.collapseWhitespace("  a \t b\n c ")).isEqualTo("a b c");
        assertThat(ScriptPatterns.collapseWhitespace(null)).isEmpty();
        assertThat(ScriptPatterns.nonBlankLines("one\n\n  two  \r\n\t\nthree"))
                .containsExactly("one", "two", "three");
    }

    private static String number(String line) {
        Matcher m = ScriptPatterns.SCENE_MARKER.matcher(line);
        assertThat(m.find()).isTrue();
        return m.group(1);
    }
}
