package com.eainde.breakdown.knowledge;

import com.eainde.breakdown.model.CharacterProfile;
import com.eainde.breakdown.pattern.ScriptPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static reference data: known characters and the entity lists used for legal clearance.
 *
 * <p>Immutable once built. Character lookup is a case-insensitive exact match on the
 * canonical name, the full name or any alias.</p>
 */
public class KnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);

    private final List<CharacterProfile> characters;
    private final Map<String, CharacterProfile> aliasIndex;
    private final Set<String> celebrities;
    private final Set<String> brands;
    private final Set<String> songs;

    public KnowledgeBase(List<CharacterProfile> characters,
                         Set<String> celebrities,
                         Set<String> brands,
                         Set<String> songs) {
        this.characters = List.copyOf(characters);
        this.celebrities = Collections.unmodifiableSet(new LinkedHashSet<>(celebrities));
        this.brands = Collections.unmodifiableSet(new LinkedHashSet<>(brands));
        this.songs = Collections.unmodifiableSet(new LinkedHashSet<>(songs));
        this.aliasIndex = Collections.unmodifiableMap(index(this.characters));
    }

    public static KnowledgeBase empty() {
        return new KnowledgeBase(List.of(), Set.of(), Set.of(), Set.of());
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param name a name as written in the script
     * @return the profile whose canonical name, full name or alias equals the name,
     *         ignoring case and surrounding whitespace
     */
    public Optional<CharacterProfile> findByAlias(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(aliasIndex.get(key(name)));
    }

    public List<CharacterProfile> characters() {
        return characters;
    }

    public Set<String> celebrities() {
        return celebrities;
    }

    public Set<String> brands() {
        return brands;
    }

    public Set<String> songs() {
        return songs;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static Map<String, CharacterProfile> index(List<CharacterProfile> profiles) {
        Map<String, CharacterProfile> index = new LinkedHashMap<>();
        for (CharacterProfile profile : profiles) {
            register(index, profile.canonicalName(), profile);
            register(index, profile.fullName(), profile);
            for (String alias : profile.aliases()) {
                register(index, alias, profile);
            }
        }
        return index;
    }

    private static void register(Map<String, CharacterProfile> index, String name, CharacterProfile profile) {
        CharacterProfile existing = index.putIfAbsent(key(name), profile);
        if (existing != null && existing != profile) {
            log.warn("Alias '{}' of {} already belongs to {}; keeping the first",
                    name, profile.canonicalName(), existing.canonicalName());
        }
    }

    private static String key(String name) {
        return ScriptPatterns.collapseWhitespace(name).toLowerCase(Locale.ROOT);
    }
}
