package com.eainde.breakdown.continuity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only copy of a {@link ContinuityGraph} at one point of a run.
 *
 * @param characterTimeline appearances per character, oldest first
 * @param itemRegistry      scene numbers per item label, oldest first
 * @param locationHistory   scene numbers per location, oldest first
 */
public record ContinuityState(
        @JsonProperty("character_timeline") Map<String, List<TimelineEntry>> characterTimeline,
        @JsonProperty("item_registry")      Map<String, List<String>> itemRegistry,
        @JsonProperty("location_history")   Map<String, List<String>> locationHistory
) implements Serializable {

    public ContinuityState {
        characterTimeline = copy(characterTimeline);
        itemRegistry = copy(itemRegistry);
        locationHistory = copy(locationHistory);
    }

    private static <V> Map<String, List<V>> copy(Map<String, List<V>> source) {
        Map<String, List<V>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        }
        return Collections.unmodifiableMap(copy);
    }
}
