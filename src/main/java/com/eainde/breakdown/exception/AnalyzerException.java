package com.eainde.breakdown.exception;

import com.eainde.breakdown.analyzer.AnalyzerKind;

/**
 * One analyzer failed on one scene. Its output is defaulted; the other analyzers
 * of that scene still contribute.
 */
public class AnalyzerException extends BreakdownException {

    private final AnalyzerKind kind;
    private final String sceneNumber;

    public AnalyzerException(AnalyzerKind kind, String sceneNumber, String message) {
        super(kind + " analyzer failed on scene " + sceneNumber + ": " + message);
        this.kind = kind;
        this.sceneNumber = sceneNumber;
    }

    public AnalyzerException(AnalyzerKind kind, String sceneNumber, Throwable cause) {
        super(kind + " analyzer failed on scene " + sceneNumber + ": " + cause.getMessage(), cause);
        this.kind = kind;
        this.sceneNumber = sceneNumber;
    }

    public AnalyzerKind getKind() {
        return kind;
    }

    public String getSceneNumber() {
        return sceneNumber;
    }
}
