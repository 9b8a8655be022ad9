package com.eainde.breakdown.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * An ordered vocabulary of bilingual terms matched against screenplay text.
 *
 * <p>Each term is a regex fragment. Latin terms are bounded so that {@code car}
 * does not match inside {@code card}; Arabic terms match as substrings, which
 * tolerates attached prefixes such as {@code ال} or {@code و}.</p>
 *
 * <pre>
 * TermSet night = TermSet.of("night", "evening", "ليل", "مساء");
 * night.foundIn("EXT. STREET - NIGHT");   // true
 * night.countIn("ليل ... evening");        // 2
 * </pre>
 *
 * <p>Matching is case-insensitive and Unicode aware. Instances are immutable
 * and safe to share between threads.</p>
 */
public final class TermSet {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final List<String> terms;
    private final List<Pattern> patterns;
    private final Pattern combined;

    private TermSet(List<String> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("TermSet requires at least one term");
        }
        this.terms = List.copyOf(terms);
        List<Pattern> compiled = new ArrayList<>(terms.size());
        for (String term : terms) {
            compiled.add(Pattern.compile(bounded(term), FLAGS));
        }
        this.patterns = Collections.unmodifiableList(compiled);
        this.combined = Pattern.compile(
                terms.stream().map(TermSet::bounded).collect(Collectors.joining("|")), FLAGS);
    }

    public static TermSet of(String... terms) {
        return new TermSet(Arrays.asList(terms));
    }

    public static TermSet of(List<String> terms) {
        return new TermSet(terms);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @return true if any term occurs in the text
     */
    public boolean foundIn(String text) {
        return text != null && combined.matcher(text).find();
    }

    /**
     * Counts how many distinct terms of this set occur in the text.
     * A term occurring several times counts once.
     */
    public int countIn(String text) {
        if (text == null) return 0;
        int count = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) count++;
        }
        return count;
    }

    /**
     * Returns the surface text of the first term, in declaration order, that occurs
     * in the text. Latin matches are lower-cased.
     */
    public Optional<String> firstIn(String text) {
        if (text == null) return Optional.empty();
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return Optional.of(normalise(m.group()));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the surface text of every match, in the order they appear in the text,
     * without duplicates.
     */
    public List<String> findAll(String text) {
        if (text == null) return List.of();
        List<String> found = new ArrayList<>();
        Matcher m = combined.matcher(text);
        while (m.find()) {
            String hit = normalise(m.group());
            if (!found.contains(hit)) found.add(hit);
        }
        return found;
    }

    /**
     * @return true if the whole token equals one of the terms
     */
    public boolean matchesToken(String token) {
        if (token == null || token.isBlank()) return false;
        String trimmed = token.strip();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(trimmed).matches()) return true;
        }
        return false;
    }

    public List<String> terms() {
        return terms;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static String bounded(String term) {
        return "(?<![\\p{IsLatin}])(?:" + term + ")(?![\\p{IsLatin}])";
    }

    private static String normalise(String hit) {
        String collapsed = hit.strip().replaceAll("\\s+", " ");
        return ScriptPatterns.isLatin(collapsed) ? collapsed.toLowerCase(Locale.ROOT) : collapsed;
    }

    @Override
    public String toString() {
        return "TermSet" + terms;
    }
}
