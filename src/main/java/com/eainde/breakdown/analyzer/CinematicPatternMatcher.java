package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.model.CinematicNote;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneType;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Suggests a production and camera note from recurring staging patterns.
 *
 * <p>Patterns are tried in a fixed order. A pattern fires when all but at most one of
 * its triggers match; the first that fires wins. Otherwise the note depends on the
 * scene type.</p>
 */
@Component
public class CinematicPatternMatcher implements SceneAnalyzer<CinematicNote> {

    private static final List<StagingPattern> PATTERNS = List.of(
            StagingPattern.of("power_confrontation",
                    "Confrontation scene: block the actors to show the power struggle.",
                    "Over-the-shoulder shots, alternate angles to stress the dynamic",
                    "sits?\\s+(?:across|opposite|facing)|يجلس.*(?:امام|أمام)",
                    "(?:office|desk).*(?:manager|director|boss|producer)|مكتب.*(?:مدير|رئيس|منتج)",
                    "(?:man|woman).*(?:dignified|imposing)|رجل.*يبدو.*وقار"),
            StagingPattern.of("discovery_moment",
                    "Discovery scene: favour the character's reaction and insert the object.",
                    "Close-up on the reaction plus an insert shot of the discovered object",
                    "\\b(?:finds?|discovers?|notices?|spots)\\b|يجد|يلمح|يكتشف|تقع عين",
                    "\\b(?:envelope|document|photo(?:graph)?|picture)s?\\b|ظرف|مستند|صورة",
                    "\\b(?:surprised?|astonish\\w*|shock\\w*)\\b|استغراب|مفاجأة"),
            StagingPattern.of("phone_conversation",
                    "Phone call: shoot one side of the conversation.",
                    "Single-sided coverage, hold on the expressions",
                    "\\b(?:phone|mobile|cellphone)\\b|هاتف|موبايل|تليفون",
                    "\\b(?:talks?\\s+(?:on|into)|calls?)\\b|يتحدث\\s+في"),
            StagingPattern.of("music_cue",
                    "Music cue: confirm playback rights before the shoot.",
                    "Blend the music into the scene",
                    "\\b(?:sings?|cassette|music|radio)\\b|يغني|صوت.*دياب|كاسيت|موسيقى",
                    "\\b(?:songs?|soundtrack)\\b|أغنية|اغنية"),
            StagingPattern.of("vehicle_scene",
                    "Car scene: process trailer or green screen depending on budget.",
                    "Car-mount rigs, match the exterior light",
                    "\\b(?:cars?|drives?|driving|taxi)\\b|سيارة|يقود",
                    "\\b(?:gets?\\s+in(?:to)?|enters|inside)\\b.*\\b(?:car|taxi)\\b|(?:يدخل|داخل).*سيارة"),
            StagingPattern.of("emotional_isolation",
                    "Emotional isolation: a wide shot to stress the loneliness.",
                    "Wide angle with mood lighting for the state of mind",
                    "\\b(?:alone|lonely|isolated)\\b|وحيد|وحيدة|منعزل",
                    "\\b(?:deeply|very)\\s+(?:worried|sad|troubled|anxious)\\b|(?:قلق|حزن|احباط).*شديد",
                    "\\b(?:thinks|broods|lost in thought)\\b|يفكر|تفكر"),
            StagingPattern.of("rapid_search",
                    "Search scene: handheld camera to build tension.",
                    "Handheld with quick cuts for urgency",
                    "\\b(?:quickly|hurriedly|frantically)\\b|بسرعة",
                    "\\b(?:search(?:es|ing)?|looks?\\s+for|rummag\\w*)\\b|يبحث|تبحث",
                    "\\b(?:anxious|nervous|tense)\\b|قلق|توتر"),
            StagingPattern.of("laptop_screen",
                    "Continuity: screen content must match the other scenes.",
                    "Screen content playback plus over-the-shoulder shot",
                    "\\b(?:laptop|computer)\\b|لابتوب|حاسب",
                    "\\b(?:opens?|looks?\\s+at|stares)\\b|يفتح|تفتح|ينظر|تنظر",
                    "\\b(?:screen|photo|picture)\\b|شاشة|صورة"));

    private static final Map<SceneType, CinematicNote> DEFAULTS = Map.of(
            SceneType.DIALOGUE_HEAVY, new CinematicNote("dialogue_default",
                    "Dialogue scene: focus on performance and interplay.",
                    "Shot-reverse-shot with medium shots for the dialogue"),
            SceneType.ACTION, new CinematicNote("action_default",
                    "Action scene: coordinate movement and blocking.",
                    "Dynamic camera movement with multiple angles"),
            SceneType.CONFRONTATION, new CinematicNote("confrontation_default",
                    "Conflict scene: escalate the pacing gradually.",
                    "Progressively tighter shots to build visual tension"));

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.CINEMATIC;
    }

    @Override
    public CinematicNote analyze(SceneBlock scene, SceneContext context) {
        return match(scene.rawText(), context.sceneType());
    }

    @Override
    public CinematicNote fallback(SceneBlock scene, SceneContext context) {
        return CinematicNote.continuityReview();
    }

    /**
     * @return the first firing pattern's note, else the scene type's default
     */
    public CinematicNote match(String text, SceneType sceneType) {
        for (StagingPattern pattern : PATTERNS) {
            if (pattern.fires(text)) {
                return pattern.note();
            }
        }
        return DEFAULTS.getOrDefault(sceneType, CinematicNote.continuityReview());
    }

    List<String> patternNames() {
        return PATTERNS.stream().map(p -> p.note().pattern()).collect(Collectors.toList());
    }

    private record StagingPattern(CinematicNote note, List<Pattern> triggers) {

        static StagingPattern of(String name, String productionNote, String cameraNote, String... triggers) {
            List<Pattern> compiled = Arrays.stream(triggers)
                    .map(t -> Pattern.compile(t, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                    .collect(Collectors.toList());
            return new StagingPattern(new CinematicNote(name, productionNote, cameraNote), compiled);
        }

        boolean fires(String text) {
            long matches = triggers.stream().filter(p -> p.matcher(text).find()).count();
            return matches >= triggers.size() - 1;
        }
    }
}
