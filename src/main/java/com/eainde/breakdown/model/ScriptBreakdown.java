package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Result of one full-script run.
 *
 * <p>A run is best-effort per scene: {@code scenes} holds every scene that was
 * refined, {@code failures} every scene that was skipped. Together they account
 * for {@code totalScenes}.</p>
 *
 * @param scenes      breakdowns in scene order
 * @param failures    skipped scenes with the reason
 * @param totalScenes number of scene blocks found in the document
 */
public record ScriptBreakdown(
        @JsonProperty("scenes")       List<Breakdown> scenes,
        @JsonProperty("failures")     List<SceneFailure> failures,
        @JsonProperty("total_scenes") int totalScenes
) implements Serializable {

    public ScriptBreakdown {
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    @JsonIgnore
    public int successCount() {
        return scenes.size();
    }

    @JsonIgnore
    public int failureCount() {
        return failures.size();
    }

    public Optional<Breakdown> scene(String sceneNumber) {
        return scenes.stream()
                .filter(b -> b.sceneNumber().equals(sceneNumber))
                .findFirst();
    }
}
