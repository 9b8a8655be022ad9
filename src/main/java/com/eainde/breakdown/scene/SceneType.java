package com.eainde.breakdown.scene;

/**
 * Dramatic classification of a scene, decided in the extraction pass and used to
 * pick synopsis templates and default cinematic notes.
 */
public enum SceneType {
    DIALOGUE_HEAVY,
    ACTION,
    DISCOVERY,
    CONFRONTATION,
    EMOTIONAL,
    TRANSITIONAL
}
