package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the cast analyzer.
 *
 * @param cast       canonical names, first-seen order, no duplicates
 * @param profiles   profile per canonical name
 * @param extrasNote background performer requirement
 */
public record CastResult(
        @JsonProperty("cast")        List<String> cast,
        @JsonProperty("profiles")    Map<String, CharacterProfile> profiles,
        @JsonProperty("extras_note") String extrasNote
) implements Serializable {

    public static final String NO_EXTRAS = "None required";

    public CastResult {
        cast = cast == null ? List.of() : List.copyOf(cast);
        profiles = profiles == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
        extrasNote = extrasNote == null ? NO_EXTRAS : extrasNote;
    }

    public static CastResult empty() {
        return new CastResult(List.of(), Map.of(), NO_EXTRAS);
    }
}
