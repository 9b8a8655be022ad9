package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.pattern.ScriptPatterns;
import com.eainde.breakdown.pattern.TermSet;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes a one-sentence synopsis from templates keyed by scene type.
 *
 * <p>A template is used only when every placeholder in it has a value extracted from the
 * scene. Templates are tried in order; when none qualifies the synopsis is an excerpt of
 * the scene's narrative lines. Arabic templates are used when the scene is mostly
 * Arabic.</p>
 */
@Component
public class SynopsisGenerator implements SceneAnalyzer<String> {

    public static final String UNAVAILABLE = "Synopsis unavailable.";

    static final int MAX_LENGTH = 250;
    static final int EXCERPT_TARGET = 200;
    static final int MIN_EXCERPT_LINE = 15;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    private static final Pattern CUE_LINE = Pattern.compile("^[^\\n:]{1,40}:");
    private static final Pattern DIALOGUE_TEXT = Pattern.compile(":[ \\t]*([^\\n]{20,100})");

    private static final Map<SceneType, List<String>> ENGLISH = new EnumMap<>(SceneType.class);
    private static final Map<SceneType, List<String>> ARABIC = new EnumMap<>(SceneType.class);

    static {
        ENGLISH.put(SceneType.DIALOGUE_HEAVY, List.of(
                "{char1} and {char2} discuss {topic}",
                "{character} talks about {topic}"));
        ENGLISH.put(SceneType.ACTION, List.of(
                "{character} {action} in the {location}",
                "{character} {action}"));
        ENGLISH.put(SceneType.DISCOVERY, List.of(
                "{character} {discover_verb} {object}",
                "{character} {discover_verb} something unexpected"));
        ENGLISH.put(SceneType.CONFRONTATION, List.of(
                "{char1} confronts {char2} over {topic}",
                "{char1} and {char2} clash"));
        ENGLISH.put(SceneType.EMOTIONAL, List.of(
                "{character} is overcome by {emotion}",
                "A moment of {emotion} in the {location}"));
        ENGLISH.put(SceneType.TRANSITIONAL, List.of(
                "{character} {action} in the {location}",
                "Transition to the {location}"));

        ARABIC.put(SceneType.DIALOGUE_HEAVY, List.of(
                "{char1} و{char2} يتحاوران حول {topic}",
                "{character} يتحدث عن {topic}"));
        ARABIC.put(SceneType.ACTION, List.of(
                "{character} {action} في {location}",
                "{character} {action}"));
        ARABIC.put(SceneType.DISCOVERY, List.of(
                "{character} {discover_verb} {object}",
                "لحظة اكتشاف: {character} {discover_verb} شيئاً"));
        ARABIC.put(SceneType.CONFRONTATION, List.of(
                "مواجهة بين {char1} و{char2} حول {topic}",
                "صراع بين {char1} و{char2}"));
        ARABIC.put(SceneType.EMOTIONAL, List.of(
                "{character} في حالة {emotion}",
                "لحظة عاطفية في {location}"));
        ARABIC.put(SceneType.TRANSITIONAL, List.of(
                "{character} {action} في {location}",
                "انتقال إلى {location}"));
    }

    private static final TermSet ACTION_VERBS = TermSet.of(
            "enters", "exits", "walks", "runs", "drives", "sits", "stands", "leaves", "arrives",
            "opens", "closes", "takes", "puts",
            "يدخل", "يخرج", "يتجه", "يمشي", "يجري", "يقود", "يجلس", "ينهض", "يفتح", "يغلق", "يأخذ", "يضع");

    private static final TermSet DISCOVERY_VERBS = TermSet.of(
            "finds", "discovers", "notices", "spots", "uncovers",
            "يجد", "يلمح", "يكتشف", "يعثر على", "يلاحظ");

    /** Object and emotion vocabularies: pattern, English value, Arabic value. */
    private static final List<Lexeme> OBJECTS = List.of(
            new Lexeme(TermSet.of("envelopes?", "ظرف"), "an envelope", "ظرف"),
            new Lexeme(TermSet.of("phones?", "mobile", "هاتف", "موبايل"), "a phone", "هاتف محمول"),
            new Lexeme(TermSet.of("laptops?", "computers?", "لابتوب", "حاسب"), "a laptop", "لابتوب"),
            new Lexeme(TermSet.of("photos?", "photographs?", "pictures?", "صورة"), "a photograph", "صورة"),
            new Lexeme(TermSet.of("documents?", "papers", "files?", "مستند", "ورق", "ملف"), "a document", "مستند"));

    private static final List<Lexeme> EMOTIONS = List.of(
            new Lexeme(TermSet.of("anxious", "worried", "nervous", "قلق", "قلقة", "متوتر", "متوترة"), "anxiety", "قلق شديد"),
            new Lexeme(TermSet.of("frustrat\\w*", "إحباط", "احباط", "محبط", "محبطة"), "frustration", "إحباط"),
            new Lexeme(TermSet.of("angry", "anger", "furious", "غضب", "غاضب", "غاضبة"), "anger", "غضب"),
            new Lexeme(TermSet.of("astonish\\w*", "surprised", "استغراب", "مستغرب"), "astonishment", "استغراب"),
            new Lexeme(TermSet.of("happy", "joy\\w*", "سعادة", "سعيد", "سعيدة", "فرح"), "joy", "سعادة"),
            new Lexeme(TermSet.of("sad", "grief", "tears", "حزن", "حزين", "حزينة"), "grief", "حزن"));

    private static final List<Lexeme> TOPICS = List.of(
            new Lexeme(TermSet.of("television", "tv", "film", "movie", "تلفزيون", "فيلم"), "career prospects", "مستقبل مهني"),
            new Lexeme(TermSet.of("concert", "wedding", "party", "حفل", "فرح", "عمرو دياب", "تامر"), "an upcoming event", "إحياء مناسبة"),
            new Lexeme(TermSet.of("protest", "demonstration", "riot", "مظاهرة"), "the security situation", "الوضع الأمني"));

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.SYNOPSIS;
    }

    @Override
    public String analyze(SceneBlock scene, SceneContext context) {
        return generate(scene.rawText(), context.sceneType(), context.rawCast(), context.header());
    }

    @Override
    public String fallback(SceneBlock scene, SceneContext context) {
        return UNAVAILABLE;
    }

    /**
     * @param text      the scene block
     * @param sceneType scene classification
     * @param cast      character names in order of appearance
     * @param header    parsed header, for the location
     * @return a sentence ending in a period, at most {@value #MAX_LENGTH} characters
     */
    public String generate(String text, SceneType sceneType, List<String> cast, SceneHeader header) {
        boolean arabic = ScriptPatterns.isMostlyArabic(text);
        Map<String, String> entities = entities(text, cast, header, arabic);

        List<String> templates = (arabic ? ARABIC : ENGLISH).get(sceneType);
        for (String template : templates) {
            Optional<String> filled = fill(template, entities);
            if (filled.isPresent()) {
                return refine(filled.get());
            }
        }
        String excerpt = excerpt(text);
        return excerpt.isEmpty() ? UNAVAILABLE : refine(excerpt);
    }

    // =========================================================================
    //  Entity extraction
    // =========================================================================

    private Map<String, String> entities(String text, List<String> cast, SceneHeader header, boolean arabic) {
        Map<String, String> entities = new HashMap<>();
        if (!cast.isEmpty()) {
            entities.put("char1", cast.get(0));
            entities.put("character", cast.get(0));
        }
        if (cast.size() > 1) {
            entities.put("char2", cast.get(1));
        }
        ACTION_VERBS.firstIn(text).ifPresent(v -> entities.put("action", v));
        DISCOVERY_VERBS.firstIn(text).ifPresent(v -> entities.put("discover_verb", v));
        first(OBJECTS, text, arabic).ifPresent(v -> entities.put("object", v));
        first(EMOTIONS, text, arabic).ifPresent(v -> entities.put("emotion", v));
        topic(text, arabic).ifPresent(v -> entities.put("topic", v));
        if (header.hasLocation()) {
            String location = header.location();
            entities.put("location", ScriptPatterns.isLatin(location) ? location.toLowerCase(Locale.ROOT) : location);
        }
        return entities;
    }

    private static Optional<String> first(List<Lexeme> lexemes, String text, boolean arabic) {
        return lexemes.stream()
                .filter(l -> l.terms().foundIn(text))
                .findFirst()
                .map(l -> arabic ? l.arabic() : l.english());
    }

    /**
     * The topic comes from the first substantial line of dialogue; without one there is no topic.
     */
    private static Optional<String> topic(String text, boolean arabic) {
        Matcher m = DIALOGUE_TEXT.matcher(text);
        if (!m.find()) return Optional.empty();
        String line = m.group(1);
        String topic = TOPICS.stream()
                .filter(l -> l.terms().foundIn(line))
                .findFirst()
                .map(l -> arabic ? l.arabic() : l.english())
                .orElse(arabic ? "موضوع خاص" : "a private matter");
        return Optional.of(topic);
    }

    // =========================================================================
    //  Rendering
    // =========================================================================

    private static Optional<String> fill(String template, Map<String, String> entities) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = entities.get(m.group(1));
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return Optional.of(out.toString());
    }

    static String excerpt(String text) {
        List<String> lines = ScriptPatterns.nonBlankLines(text);
        List<String> picked = new ArrayList<>();
        int length = 0;
        for (String line : lines.subList(Math.min(1, lines.size()), lines.size())) {
            if (CUE_LINE.matcher(line).find() || line.length() < MIN_EXCERPT_LINE) {
                continue;
            }
            picked.add(line);
            length += line.length() + (picked.size() > 1 ? 1 : 0);
            if (length > EXCERPT_TARGET) break;
        }
        String summary = String.join(" ", picked);
        return summary.length() > MAX_LENGTH ? summary.substring(0, MAX_LENGTH - 3) + "..." : summary;
    }

    static String refine(String synopsis) {
        String s = synopsis.strip();
        if (s.isEmpty()) return UNAVAILABLE;
        if (Character.isLowerCase(s.charAt(0))) {
            s = Character.toUpperCase(s.charAt(0)) + s.substring(1);
        }
        if (!(s.endsWith(".") || s.endsWith("!") || s.endsWith("?") || s.endsWith("؟"))) {
            s = s + ".";
        }
        if (s.length() > MAX_LENGTH) {
            s = s.substring(0, MAX_LENGTH - 3) + "...";
        }
        return s;
    }

    private record Lexeme(TermSet terms, String english, String arabic) {
    }

    Map<SceneType, List<String>> templates(boolean arabic) {
        return new LinkedHashMap<>(arabic ? ARABIC : ENGLISH);
    }
}
