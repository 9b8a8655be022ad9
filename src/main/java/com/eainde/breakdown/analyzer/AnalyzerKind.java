package com.eainde.breakdown.analyzer;

/**
 * The enrichment analyzers. Each kind has exactly one registered implementation.
 */
public enum AnalyzerKind {
    CAST,
    PROPS,
    WARDROBE,
    EFFECTS,
    LEGAL,
    CINEMATIC,
    SYNOPSIS
}
