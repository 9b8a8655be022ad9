package com.eainde.breakdown.workflow.nodes;

import com.eainde.breakdown.analyzer.AnalyzerKind;
import com.eainde.breakdown.analyzer.AnalyzerRegistry;
import com.eainde.breakdown.analyzer.SceneAnalyzer;
import com.eainde.breakdown.analyzer.SceneContext;
import com.eainde.breakdown.exception.AnalyzerException;
import com.eainde.breakdown.model.Breakdown;
import com.eainde.breakdown.model.CastResult;
import com.eainde.breakdown.model.CinematicNote;
import com.eainde.breakdown.model.EffectsReport;
import com.eainde.breakdown.model.LegalAlert;
import com.eainde.breakdown.model.PropInventory;
import com.eainde.breakdown.model.SceneStage;
import com.eainde.breakdown.model.WardrobeResult;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.workflow.PipelineOptions;
import com.eainde.breakdown.workflow.PipelineRun;
import com.eainde.breakdown.workflow.PipelineRunRegistry;
import com.eainde.breakdown.workflow.state.SceneState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Pass 2: runs the enabled analyzers of one scene concurrently and assembles the draft
 * breakdown.
 *
 * <p>Wardrobe inference waits for the cast analyzer. A disabled analyzer contributes its
 * fallback. A failing analyzer also contributes its fallback and leaves a warning on the
 * breakdown; the other analyzers are unaffected.</p>
 */
@Component
public class EnrichSceneNode implements AsyncNodeAction<SceneState> {

    private static final Logger log = LoggerFactory.getLogger(EnrichSceneNode.class);

    private final AnalyzerRegistry analyzers;
    private final PipelineRunRegistry runs;
    private final Executor analyzerExecutor;

    public EnrichSceneNode(AnalyzerRegistry analyzers,
                           PipelineRunRegistry runs,
                           @Qualifier("analyzerExecutor") Executor analyzerExecutor) {
        this.analyzers = analyzers;
        this.runs = runs;
        this.analyzerExecutor = analyzerExecutor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SceneState state) {
        PipelineRun run = runs.get(state.getRunId());
        SceneBlock scene = state.getScene();
        SceneHeader header = state.getHeader();
        PipelineOptions options = run.options();
        SceneContext context = SceneContext.of(header, state.getSceneType(), state.getRawCast(), run.profiles());
        Map<AnalyzerKind, String> warnings = new ConcurrentHashMap<>();

        CompletableFuture<CastResult> cast = analyze(AnalyzerKind.CAST, scene, context, options, warnings);
        CompletableFuture<WardrobeResult> wardrobe = cast.thenCompose(
                c -> this.<WardrobeResult>analyze(AnalyzerKind.WARDROBE, scene, context.withCast(c), options, warnings));
        CompletableFuture<PropInventory> props = analyze(AnalyzerKind.PROPS, scene, context, options, warnings);
        CompletableFuture<EffectsReport> effects = analyze(AnalyzerKind.EFFECTS, scene, context, options, warnings);
        CompletableFuture<List<LegalAlert>> legal = analyze(AnalyzerKind.LEGAL, scene, context, options, warnings);
        CompletableFuture<CinematicNote> cinematic = analyze(AnalyzerKind.CINEMATIC, scene, context, options, warnings);
        CompletableFuture<String> synopsis = analyze(AnalyzerKind.SYNOPSIS, scene, context, options, warnings);

        return CompletableFuture.allOf(cast, wardrobe, props, effects, legal, cinematic, synopsis)
                .thenApply(done -> {
                    CastResult castResult = cast.join();
                    WardrobeResult wardrobeResult = wardrobe.join();
                    CinematicNote note = cinematic.join();

                    Breakdown draft = Breakdown.builder()
                            .sceneNumber(scene.sceneNumber())
                            .header(header)
                            .sceneType(state.getSceneType())
                            .synopsis(synopsis.join())
                            .cast(castResult.cast())
                            .castProfiles(castResult.profiles())
                            .props(props.join())
                            .wardrobe(wardrobeResult.specs())
                            .makeup(wardrobeResult.makeup())
                            .extras(castResult.extrasNote())
                            .effects(effects.join())
                            .legalAlerts(legal.join())
                            .cinematicNote(note)
                            .cameraLighting(cameraLighting(note, header))
                            .analyzerWarnings(ordered(warnings))
                            .build();
                    log.debug("Scene {} enriched: cast {}, {} items, {} warnings", scene.sceneNumber(),
                            draft.cast(), draft.props().allItems().size(), warnings.size());
                    Map<String, Object> update = Map.of(SceneState.BREAKDOWN, draft, SceneState.STAGE, SceneStage.ENRICHED);
                    return update;
                });
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private <R> CompletableFuture<R> analyze(AnalyzerKind kind, SceneBlock scene, SceneContext context,
                                             PipelineOptions options, Map<AnalyzerKind, String> warnings) {
        SceneAnalyzer<R> analyzer = analyzers.get(kind);
        if (!options.isEnabled(kind)) {
            return CompletableFuture.completedFuture(analyzer.fallback(scene, context));
        }
        return CompletableFuture.supplyAsync(() -> analyzer.analyze(scene, context), analyzerExecutor)
                .exceptionally(ex -> {
                    AnalyzerException failure = asAnalyzerException(kind, scene, ex);
                    log.warn("Scene {}: {} analyzer defaulted: {}", scene.sceneNumber(), kind, failure.getMessage());
                    warnings.put(kind, failure.getMessage());
                    return analyzer.fallback(scene, context);
                });
    }

    private static AnalyzerException asAnalyzerException(AnalyzerKind kind, SceneBlock scene, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof AnalyzerException) {
            return (AnalyzerException) cause;
        }
        return new AnalyzerException(kind, scene.sceneNumber(), cause);
    }

    private static List<String> ordered(Map<AnalyzerKind, String> warnings) {
        List<String> ordered = new ArrayList<>();
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            String warning = warnings.get(kind);
            if (warning != null) ordered.add(warning);
        }
        return ordered;
    }

    private static String cameraLighting(CinematicNote note, SceneHeader header) {
        String lighting = header.interiorExterior() + " " + header.timeOfDay() + " lighting";
        return note.cameraNote().isBlank() ? lighting : note.cameraNote() + "; " + lighting;
    }
}
