package com.eainde.breakdown.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared regular expressions for screenplay structure: scene markers, dialogue
 * cues and stage directions, in English and Arabic.
 *
 * <p>All patterns are compiled once. Vocabulary that is specific to a single
 * analyzer lives with that analyzer as a {@link TermSet}.</p>
 */
public final class ScriptPatterns {

    private ScriptPatterns() {
    }

    /**
     * A scene marker at the start of a line: {@code Scene 12}, {@code SC. 4},
     * {@code Scene #3}, {@code مشهد ٥}, {@code المشهد 7}. Group 1 is the number,
     * in ASCII or Arabic-Indic digits.
     */
    public static final Pattern SCENE_MARKER = Pattern.compile(
            "^[ \\t\\u00A0]*(?:scene|sc\\.?|مشهد|المشهد)[ \\t]*(?:#|no\\.?)?[ \\t]*([0-9\\u0660-\\u0669\\u06F0-\\u06F9]+)",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /** The scene marker, its number and any trailing separator, anchored at the start of a header. */
    public static final Pattern SCENE_MARKER_PREFIX = Pattern.compile(
            "^\\s*(?:scene|sc\\.?|مشهد|المشهد)\\s*(?:#|no\\.?)?\\s*[0-9\\u0660-\\u0669\\u06F0-\\u06F9]+\\s*[:.\\-–—]?\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /**
     * A dialogue cue: a short, letters-only name at the start of a line followed by a colon.
     * Group 1 is the candidate name.
     */
    public static final Pattern DIALOGUE_CUE = Pattern.compile(
            "^[ \\t]*([\\p{L}][\\p{L}\\p{M} '.\\-]{0,40}?)[ \\t]*:",
            Pattern.MULTILINE);

    /**
     * English stage direction: {@code JOHN enters}, {@code Mary exits}. Case-sensitive on purpose
     * so that only capitalised words qualify as names. Group 1 is the name.
     */
    public static final Pattern STAGE_DIRECTION_EN = Pattern.compile(
            "(?<![\\p{L}])(\\p{Lu}{2,}(?:[ \\t]+\\p{Lu}{2,}){0,2}|\\p{Lu}\\p{Ll}+(?:[ \\t]+\\p{Lu}\\p{Ll}+)?)"
                    + "[ \\t]+(?:enters|exits|leaves|arrives|sits|stands|walks|runs|drives|returns)(?![\\p{L}])");

    /**
     * Arabic stage direction: the verb comes first, the name follows ({@code يدخل كريم}).
     * Group 1 is the name.
     */
    public static final Pattern STAGE_DIRECTION_AR = Pattern.compile(
            "(?:يدخل|تدخل|يخرج|تخرج|يجلس|تجلس|يقف|تقف)\\s+([\\p{IsArabic}&&\\p{L}]+)");

    /** Splits header segments: dashes, pipes, colons and slashes. */
    public static final Pattern HEADER_SEPARATOR = Pattern.compile("[\\-–—|:/]+");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LATIN_LETTER = Pattern.compile("\\p{IsLatin}");
    private static final Pattern ARABIC_LETTER = Pattern.compile("[\\p{IsArabic}&&\\p{L}]");

    /** Single-letter prefixes written attached to the next word: and, with, for, so, like. */
    private static final String PROCLITICS = "وبلفك";

    // =========================================================================
    //  Helpers
    // =========================================================================

    public static String collapseWhitespace(String text) {
        return text == null ? "" : WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }

    /**
     * Non-blank lines of the text, trimmed, in order.
     */
    public static List<String> nonBlankLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null) return lines;
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) lines.add(line.strip());
        }
        return lines;
    }

    public static boolean isDialogueCue(String line) {
        return DIALOGUE_CUE.matcher(line).find();
    }

    /**
     * @return true if the text contains Latin letters and no Arabic letters
     */
    public static boolean isLatin(String text) {
        return LATIN_LETTER.matcher(text).find() && !ARABIC_LETTER.matcher(text).find();
    }

    /**
     * @return true if Arabic letters outnumber Latin letters in the text
     */
    public static boolean isMostlyArabic(String text) {
        if (text == null) return false;
        return count(ARABIC_LETTER, text) > count(LATIN_LETTER, text);
    }

    /**
     * Whether an Arabic match starting at {@code start} begins a word. Only a proclitic
     * letter and the article {@code ال}, in that order, may sit between the match and the
     * previous non-letter: {@code بالرف} qualifies, {@code الغرفة} and {@code يعرف} do not
     * for {@code رف}.
     */
    public static boolean startsArabicWord(String text, int start) {
        int i = start;
        if (i >= 2 && text.startsWith("ال", i - 2)) i -= 2;
        if (i >= 1 && PROCLITICS.indexOf(text.charAt(i - 1)) >= 0) i -= 1;
        return i == 0 || !isArabicLetter(text.charAt(i - 1));
    }

    private static boolean isArabicLetter(char c) {
        return Character.isLetter(c) && Character.UnicodeBlock.of(c) == Character.UnicodeBlock.ARABIC;
    }

    private static int count(Pattern pattern, String text) {
        int n = 0;
        Matcher m = pattern.matcher(text);
        while (m.find()) n++;
        return n;
    }
}
