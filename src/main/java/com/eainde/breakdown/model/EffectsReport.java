package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * @param specialEffects practical effects on set
 * @param visualEffects  effects added or replaced in post
 * @param sound          sound cues the sound department must plan for
 */
public record EffectsReport(
        @JsonProperty("special_effects") List<String> specialEffects,
        @JsonProperty("visual_effects")  List<String> visualEffects,
        @JsonProperty("sound")           List<String> sound
) implements Serializable {

    public EffectsReport {
        specialEffects = specialEffects == null ? List.of() : List.copyOf(specialEffects);
        visualEffects = visualEffects == null ? List.of() : List.copyOf(visualEffects);
        sound = sound == null ? List.of() : List.copyOf(sound);
    }

    public static EffectsReport empty() {
        return new EffectsReport(List.of(), List.of(), List.of());
    }
}
