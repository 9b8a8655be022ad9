package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.knowledge.ProfileRegistry;
import com.eainde.breakdown.model.CastResult;
import com.eainde.breakdown.model.CharacterProfile;
import com.eainde.breakdown.pattern.ScriptPatterns;
import com.eainde.breakdown.pattern.TermSet;
import com.eainde.breakdown.scene.SceneBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the characters of a scene.
 *
 * <p>Names come from dialogue cues ({@code JOHN: ...}) and from stage directions
 * ({@code JOHN enters}, {@code يدخل كريم}). A name has at most three words and
 * letters only. Each name is canonicalised through the run's
 * {@link ProfileRegistry}; duplicates are dropped keeping first-seen order.</p>
 */
@Component
public class CastAnalyzer implements SceneAnalyzer<CastResult> {

    private static final Logger log = LoggerFactory.getLogger(CastAnalyzer.class);

    static final int MAX_NAME_TOKENS = 3;

    private static final Pattern NAME_SHAPE = Pattern.compile("[\\p{L}\\p{M}]+(?:[ '.\\-]+[\\p{L}\\p{M}]+)*\\.?");

    /** Words that sit where a name would but are not characters. */
    private static final Set<String> RESERVED = Set.of(
            "scene", "sc", "int", "ext", "day", "night", "note", "notes", "cut to", "fade in", "fade out",
            "he", "she", "they", "it", "we", "i", "you", "the", "a", "an", "his", "her", "their",
            "someone", "everyone", "nobody", "suddenly", "then", "later", "meanwhile",
            "مشهد", "المشهد", "داخلي", "خارجي", "ليل", "نهار", "هو", "هي", "هم");

    /** Words that can follow an Arabic movement verb without being a name. */
    private static final Set<String> ARABIC_NON_NAMES = Set.of(
            "إلى", "الى", "في", "على", "من", "عن", "مع", "ببطء", "مسرعا", "مسرعاً", "وهو", "وهي",
            "بسرعة", "فجأة", "ثم", "هو", "هي");

    private static final TermSet CROWD = TermSet.of(
            "crowds?", "extras", "passers-?by", "audience", "bystanders", "onlookers", "mob",
            "جمهور", "حشد", "زحام", "مارة", "ناس كتير");

    static final String CROWD_NOTE = "Background extras required (crowd), estimate 10-20 people";

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.CAST;
    }

    @Override
    public CastResult analyze(SceneBlock scene, SceneContext context) {
        List<String> rawNames = context.rawCast().isEmpty() ? extractNames(scene.rawText()) : context.rawCast();
        ProfileRegistry profiles = context.profiles();

        Map<String, CharacterProfile> byName = new LinkedHashMap<>();
        for (String raw : rawNames) {
            CharacterProfile profile = profiles.resolve(raw);
            byName.putIfAbsent(profile.canonicalName(), profile);
        }

        String extras = CROWD.foundIn(scene.rawText()) ? CROWD_NOTE : CastResult.NO_EXTRAS;
        log.debug("Scene {}: cast {} from {} raw names", scene.sceneNumber(), byName.keySet(), rawNames.size());
        return new CastResult(new ArrayList<>(byName.keySet()), byName, extras);
    }

    /**
     * The raw names are still meaningful when canonicalisation fails: they become the cast.
     */
    @Override
    public CastResult fallback(SceneBlock scene, SceneContext context) {
        Map<String, CharacterProfile> byName = new LinkedHashMap<>();
        for (String raw : context.rawCast()) {
            byName.putIfAbsent(raw, CharacterProfile.synthesized(raw));
        }
        return new CastResult(new ArrayList<>(byName.keySet()), byName, CastResult.NO_EXTRAS);
    }

    /**
     * Extracts character names as written, without canonicalisation.
     * The header line is skipped.
     *
     * @param text the scene block
     * @return distinct names in first-seen order: dialogue cues first, then stage directions
     */
    public List<String> extractNames(String text) {
        List<String> lines = ScriptPatterns.nonBlankLines(text);
        String body = lines.size() > 1 ? String.join("\n", lines.subList(1, lines.size())) : "";

        Set<String> names = new LinkedHashSet<>();

        Matcher cue = ScriptPatterns.DIALOGUE_CUE.matcher(body);
        while (cue.find()) {
            accept(cue.group(1), names);
        }

        Matcher english = ScriptPatterns.STAGE_DIRECTION_EN.matcher(body);
        while (english.find()) {
            accept(english.group(1), names);
        }

        Matcher arabic = ScriptPatterns.STAGE_DIRECTION_AR.matcher(body);
        while (arabic.find()) {
            String word = arabic.group(1);
            if (!ARABIC_NON_NAMES.contains(word) && !word.startsWith("ال")) {
                accept(word, names);
            }
        }
        return new ArrayList<>(names);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static void accept(String candidate, Set<String> names) {
        String name = ScriptPatterns.collapseWhitespace(candidate);
        if (name.length() < 2) return;
        if (name.split(" ").length > MAX_NAME_TOKENS) return;
        if (!NAME_SHAPE.matcher(name).matches()) return;
        if (RESERVED.contains(name.toLowerCase(Locale.ROOT))) return;
        names.add(name);
    }
}
