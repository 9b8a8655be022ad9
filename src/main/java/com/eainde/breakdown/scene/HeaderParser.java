package com.eainde.breakdown.scene;

import com.eainde.breakdown.exception.SceneParseException;
import com.eainde.breakdown.pattern.ScriptPatterns;
import com.eainde.breakdown.pattern.TermSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives a {@link SceneHeader} from the first line of a scene block.
 *
 * <ul>
 *   <li>EXT only when an exterior token is present and no interior token is.</li>
 *   <li>NIGHT/DAY from the header; if the header names neither, the whole block is
 *       scanned for a night word, otherwise DAY.</li>
 *   <li>Location is the header with every classifier token removed. If three
 *       characters or fewer remain, the block's second line is used, then
 *       {@link SceneHeader#UNSPECIFIED}.</li>
 * </ul>
 */
@Component
public class HeaderParser {

    private static final TermSet INTERIOR = TermSet.of("int\\.?", "interior", "داخلي", "داخلى");
    private static final TermSet EXTERIOR = TermSet.of("ext\\.?", "exterior", "خارجي", "خارجى");
    private static final TermSet DAY = TermSet.of(
            "day", "morning", "afternoon", "dawn", "نهار", "نهارا", "نهاراً", "صباح", "صباحا", "صباحاً");
    private static final TermSet NIGHT = TermSet.of(
            "night", "evening", "dusk", "ليل", "ليلا", "ليلاً", "مساء", "مساءً");
    private static final TermSet FILLER = TermSet.of("continuous", "cont'd", "later", "مستمر");

    /** Night as a whole word anywhere in the block; Arabic suffixes would otherwise catch names like ليلى. */
    private static final Pattern NIGHT_IN_TEXT = Pattern.compile(
            "(?<![\\p{L}])(?:night|ليل|ليلا|ليلاً|مساء|مساءً)(?![\\p{L}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[\\s\\-–—|:/]+");
    private static final int MIN_LOCATION_LENGTH = 4;

    /**
     * @param block the scene block
     * @return the parsed header, with defaults for anything not found
     * @throws SceneParseException if the block has no text at all
     */
    public SceneHeader parse(SceneBlock block) {
        List<String> lines = ScriptPatterns.nonBlankLines(block.rawText());
        if (lines.isEmpty()) {
            throw new SceneParseException(block.sceneNumber(), "scene block is empty");
        }
        String header = ScriptPatterns.collapseWhitespace(lines.get(0));
        List<String> tokens = tokens(header);

        boolean interior = tokens.stream().anyMatch(INTERIOR::matchesToken);
        boolean exterior = tokens.stream().anyMatch(EXTERIOR::matchesToken);
        InteriorExterior intExt = exterior && !interior ? InteriorExterior.EXT : InteriorExterior.INT;

        TimeOfDay timeOfDay;
        if (tokens.stream().anyMatch(NIGHT::matchesToken)) {
            timeOfDay = TimeOfDay.NIGHT;
        } else if (tokens.stream().anyMatch(DAY::matchesToken)) {
            timeOfDay = TimeOfDay.DAY;
        } else {
            timeOfDay = NIGHT_IN_TEXT.matcher(block.rawText()).find() ? TimeOfDay.NIGHT : TimeOfDay.DAY;
        }

        return new SceneHeader(intExt, timeOfDay, location(header, lines));
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private String location(String header, List<String> lines) {
        String remainder = ScriptPatterns.SCENE_MARKER_PREFIX.matcher(header).replaceFirst("");

        List<String> kept = new ArrayList<>();
        for (String part : ScriptPatterns.HEADER_SEPARATOR.split(remainder)) {
            StringBuilder segment = new StringBuilder();
            for (String word : part.trim().split("\\s+")) {
                if (word.isEmpty() || isClassifier(word)) continue;
                if (segment.length() > 0) segment.append(' ');
                segment.append(word);
            }
            String cleaned = stripPunctuation(segment.toString());
            if (!cleaned.isEmpty()) kept.add(cleaned);
        }

        String location = String.join(" - ", kept);
        if (location.length() >= MIN_LOCATION_LENGTH) {
            return location;
        }
        if (lines.size() > 1) {
            return ScriptPatterns.collapseWhitespace(lines.get(1));
        }
        return SceneHeader.UNSPECIFIED;
    }

    private static boolean isClassifier(String word) {
        String bare = stripPunctuation(word);
        if (bare.isEmpty()) return true;
        return INTERIOR.matchesToken(word) || INTERIOR.matchesToken(bare)
                || EXTERIOR.matchesToken(word) || EXTERIOR.matchesToken(bare)
                || DAY.matchesToken(bare) || NIGHT.matchesToken(bare)
                || FILLER.matchesToken(bare);
    }

    private static List<String> tokens(String header) {
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(header)) {
            String bare = stripPunctuation(token);
            if (!bare.isEmpty()) {
                tokens.add(token);
                if (!bare.equals(token)) tokens.add(bare);
            }
        }
        return tokens;
    }

    private static String stripPunctuation(String text) {
        return text.replaceAll("^[\\s.,;()\\[\\]]+|[\\s.,;()\\[\\]]+$", "");
    }
}
