package com.eainde.breakdown.scene;

import com.eainde.breakdown.pattern.ScriptPatterns;
import com.eainde.breakdown.pattern.TermSet;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies a scene by the share of dialogue lines and by verb and mood vocabulary.
 *
 * <ol>
 *   <li>More than 40% of body lines are dialogue cues: CONFRONTATION if conflict words
 *       appear, otherwise DIALOGUE_HEAVY.</li>
 *   <li>A discovery verb: DISCOVERY.</li>
 *   <li>Two or more distinct action verbs: ACTION.</li>
 *   <li>An emotion word: EMOTIONAL.</li>
 *   <li>Otherwise TRANSITIONAL.</li>
 * </ol>
 */
@Component
public class SceneTypeClassifier {

    static final double DIALOGUE_RATIO_THRESHOLD = 0.4;

    private static final TermSet CONFLICT = TermSet.of(
            "confront(?:s|ation)?", "argue(?:s|d)?", "argument", "fights?", "conflict", "dispute", "accuses?",
            "مواجهة", "صراع", "خلاف", "جدال");

    static final TermSet DISCOVERY_VERBS = TermSet.of(
            "finds", "discovers", "notices", "spots", "uncovers", "stumbles upon",
            "يجد", "تجد", "يلمح", "تلمح", "يكتشف", "تكتشف", "يعثر على", "تعثر على", "تقع عينه", "تقع عينها");

    static final TermSet ACTION_VERBS = TermSet.of(
            "enters", "exits", "runs", "jumps", "drives", "hits", "punches", "chases", "grabs", "climbs",
            "يدخل", "يخرج", "يجري", "يقفز", "يقود", "يضرب");

    private static final TermSet EMOTION = TermSet.of(
            "worried", "anxious", "sad", "grief", "frustrated", "tears", "cries", "happy", "joy",
            "قلق", "حزن", "احباط", "إحباط", "سعادة", "فرح");

    /**
     * @param text the full scene block, header line first
     */
    public SceneType classify(String text) {
        List<String> lines = ScriptPatterns.nonBlankLines(text);
        List<String> body = lines.size() > 1 ? lines.subList(1, lines.size()) : List.of();

        long cues = body.stream().filter(ScriptPatterns::isDialogueCue).count();
        double ratio = body.isEmpty() ? 0.0 : (double) cues / body.size();

        if (ratio > DIALOGUE_RATIO_THRESHOLD) {
            return CONFLICT.foundIn(text) ? SceneType.CONFRONTATION : SceneType.DIALOGUE_HEAVY;
        }
        if (DISCOVERY_VERBS.foundIn(text)) {
            return SceneType.DISCOVERY;
        }
        if (ACTION_VERBS.countIn(text) >= 2) {
            return SceneType.ACTION;
        }
        if (EMOTION.foundIn(text)) {
            return SceneType.EMOTIONAL;
        }
        return SceneType.TRANSITIONAL;
    }
}
