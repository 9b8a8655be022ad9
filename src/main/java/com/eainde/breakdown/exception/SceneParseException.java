package com.eainde.breakdown.exception;

/**
 * Extraction of a single scene failed. The scene is skipped, the run continues.
 */
public class SceneParseException extends BreakdownException {

    private final String sceneNumber;

    public SceneParseException(String sceneNumber, String message) {
        super("Scene " + sceneNumber + ": " + message);
        this.sceneNumber = sceneNumber;
    }

    public SceneParseException(String sceneNumber, String message, Throwable cause) {
        super("Scene " + sceneNumber + ": " + message, cause);
        this.sceneNumber = sceneNumber;
    }

    public String getSceneNumber() {
        return sceneNumber;
    }
}
