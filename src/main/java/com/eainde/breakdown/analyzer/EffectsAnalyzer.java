package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.model.EffectsReport;
import com.eainde.breakdown.pattern.ScriptPatterns;
import com.eainde.breakdown.pattern.TermSet;
import com.eainde.breakdown.scene.SceneBlock;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists the special effects, visual effects and sound cues a scene needs.
 * Cues are additive: one scene can need rain, an explosion and music.
 */
@Component
public class EffectsAnalyzer implements SceneAnalyzer<EffectsReport> {

    private static final Map<TermSet, String> SPECIAL = new LinkedHashMap<>();
    private static final Map<TermSet, String> VISUAL = new LinkedHashMap<>();
    private static final Map<TermSet, String> SOUND = new LinkedHashMap<>();

    static {
        SPECIAL.put(TermSet.of("explosions?", "explodes", "blasts?", "smoke", "fire", "flames", "انفجار", "دخان", "نار", "تفجير"),
                "practical effects (explosion/smoke)");
        SPECIAL.put(TermSet.of("rain(?:s|ing)?", "snow(?:s|ing)?", "wind", "storm", "مطر", "ثلج", "رياح", "عاصفة"),
                "weather effects");
        SPECIAL.put(TermSet.of("gunshots?", "shoots", "fires (?:a|the) (?:gun|shot)", "طلق", "رصاص"),
                "gunfire and squibs");

        VISUAL.put(TermSet.of("screens?", "monitors?", "playback", "شاشة"),
                "screen content replacement (playback)");
        VISUAL.put(TermSet.of("green ?screen", "chroma", "كروما"),
                "green-screen compositing");
        VISUAL.put(TermSet.of("flashback", "dream", "vision", "حلم", "فلاش باك"),
                "flashback/dream treatment");

        SOUND.put(TermSet.of("says", "tells", "talks", "speaks", "asks", "يتحدث", "تتحدث", "يقول", "تقول", "حوار"),
                "live dialogue");
        SOUND.put(TermSet.of("sings", "singing", "songs?", "music", "radio", "cassette", "soundtrack", "يغني", "موسيقى", "أغنية", "اغنية", "كاسيت"),
                "music");
        SOUND.put(TermSet.of("knocks?", "knocking", "يطرق", "طرق"),
                "door knock");
        SOUND.put(TermSet.of("engines?", "horns?", "honks", "tires screech", "محرك", "صوت سيارة", "كلاكس"),
                "vehicle sounds");
        SOUND.put(TermSet.of("rings", "ringing", "ringtone", "يرن", "رنين"),
                "phone ring");
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.EFFECTS;
    }

    @Override
    public EffectsReport analyze(SceneBlock scene, SceneContext context) {
        String text = scene.rawText();
        Set<String> sound = new LinkedHashSet<>(matching(SOUND, text));
        if (hasDialogueCue(text)) {
            sound.add("live dialogue");
        }
        return new EffectsReport(matching(SPECIAL, text), matching(VISUAL, text), List.copyOf(sound));
    }

    @Override
    public EffectsReport fallback(SceneBlock scene, SceneContext context) {
        return EffectsReport.empty();
    }

    private static List<String> matching(Map<TermSet, String> rules, String text) {
        Set<String> found = new LinkedHashSet<>();
        rules.forEach((terms, cue) -> {
            if (terms.foundIn(text)) found.add(cue);
        });
        return List.copyOf(found);
    }

    private static boolean hasDialogueCue(String text) {
        List<String> lines = ScriptPatterns.nonBlankLines(text);
        return lines.stream().skip(1).anyMatch(ScriptPatterns::isDialogueCue);
    }
}
