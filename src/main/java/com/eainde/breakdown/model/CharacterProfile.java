package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Everything known about a character.
 *
 * <p>Profiles come from the knowledge base (looked up by alias) or are synthesised
 * from a name found in the script, in which case only the names are set.</p>
 *
 * @param canonicalName      the name used in cast lists
 * @param fullName           full display name
 * @param aliases            alternative spellings and short names
 * @param gender             optional
 * @param ageRange           optional, e.g. {@code "30s"}
 * @param profession         optional, drives wardrobe inference
 * @param socialClass        optional: {@code upper}, {@code upper-middle}, {@code middle}
 * @param psychologicalState optional, e.g. {@code paralyzed}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CharacterProfile(
        @JsonProperty("canonical_name")      String canonicalName,
        @JsonProperty("full_name")           String fullName,
        @JsonProperty("aliases")             List<String> aliases,
        @JsonProperty("gender")              String gender,
        @JsonProperty("age_range")           String ageRange,
        @JsonProperty("profession")          String profession,
        @JsonProperty("social_class")        String socialClass,
        @JsonProperty("psychological_state") String psychologicalState
) implements Serializable {

    public CharacterProfile {
        if (canonicalName == null || canonicalName.isBlank()) {
            canonicalName = fullName;
        }
        if (canonicalName == null || canonicalName.isBlank()) {
            throw new IllegalArgumentException("CharacterProfile requires a canonical or full name");
        }
        fullName = fullName == null || fullName.isBlank() ? canonicalName : fullName;
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    /**
     * A profile for a name that the knowledge base does not know.
     */
    public static CharacterProfile synthesized(String name) {
        return new CharacterProfile(name, name, List.of(), null, null, null, null, null);
    }
}
