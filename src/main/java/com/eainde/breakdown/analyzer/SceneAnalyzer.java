package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.scene.SceneBlock;

/**
 * One enrichment capability applied to a single scene.
 *
 * <p>Implementations are stateless and thread-safe: the enrichment pass calls them
 * concurrently for different scenes and for different analyzers of the same scene.
 * They read the scene and the context only; shared state belongs to the
 * continuity graph, which analyzers never touch.</p>
 *
 * @param <R> the partial result this analyzer contributes to the breakdown
 */
public interface SceneAnalyzer<R> {

    AnalyzerKind kind();

    /**
     * @param scene   the scene block
     * @param context what the extraction pass learned about the scene
     * @return this analyzer's contribution, never null
     */
    R analyze(SceneBlock scene, SceneContext context);

    /**
     * The output used when this analyzer is disabled or fails on a scene.
     */
    R fallback(SceneBlock scene, SceneContext context);
}
