package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Costume for one character in one scene.
 *
 * @param character      canonical character name
 * @param description    merged wardrobe description, or {@code "context-dependent"}
 * @param inferred       always true; descriptions are inferred, never quoted
 * @param continuityNote reference to earlier scenes, filled during refinement
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WardrobeSpec(
        @JsonProperty("character")       String character,
        @JsonProperty("description")     String description,
        @JsonProperty("is_inferred")     boolean inferred,
        @JsonProperty("continuity_note") String continuityNote
) implements Serializable {

    public static WardrobeSpec inferred(String character, String description) {
        return new WardrobeSpec(character, description, true, null);
    }

    public WardrobeSpec withContinuityNote(String note) {
        return new WardrobeSpec(character, description, inferred, note);
    }
}
