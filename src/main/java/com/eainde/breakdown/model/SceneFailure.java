package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A scene that produced no breakdown.
 *
 * @param sceneNumber the scene that failed
 * @param stage       the stage the scene was being taken to when it failed
 * @param message     the error message
 */
public record SceneFailure(
        @JsonProperty("scene_number") String sceneNumber,
        @JsonProperty("stage")        SceneStage stage,
        @JsonProperty("message")      String message
) implements Serializable {
}
