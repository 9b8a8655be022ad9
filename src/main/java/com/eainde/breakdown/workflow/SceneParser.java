package com.eainde.breakdown.workflow;

import com.eainde.breakdown.model.Breakdown;
import com.eainde.breakdown.model.SceneFailure;
import com.eainde.breakdown.model.SceneStage;
import com.eainde.breakdown.model.ScriptBreakdown;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneSplitter;
import com.eainde.breakdown.scene.ScriptReader;
import com.eainde.breakdown.workflow.state.SceneState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Turns a whole script into per-scene breakdowns.
 *
 * <p>Each scene goes through the {@code sceneWorkflow} graph twice:</p>
 * <ol>
 *   <li>extraction and enrichment, for up to {@code scene-batch-size} scenes at a time on
 *       the scene executor;</li>
 *   <li>refinement, one scene at a time in document order, since continuity depends on
 *       every earlier scene being registered.</li>
 * </ol>
 * <p>Failures are scene-local. A scene that cannot be extracted, or whose graph run throws,
 * is reported in {@link ScriptBreakdown#failures()} and the run goes on. Only a document
 * without scene markers fails the whole run.</p>
 */
@Log4j2
@Service
public class SceneParser {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_SCENE = "scene";

    private final SceneSplitter splitter;
    private final ScriptReader reader;
    private final CompiledGraph<SceneState> sceneWorkflow;
    private final PipelineRunRegistry runs;
    private final Executor sceneExecutor;
    private final PipelineSettings settings;

    public SceneParser(SceneSplitter splitter,
                       ScriptReader reader,
                       @Qualifier("sceneWorkflow") CompiledGraph<SceneState> sceneWorkflow,
                       PipelineRunRegistry runs,
                       @Qualifier("sceneExecutor") Executor sceneExecutor,
                       PipelineSettings settings) {
        this.splitter = splitter;
        this.reader = reader;
        this.sceneWorkflow = sceneWorkflow;
        this.runs = runs;
        this.sceneExecutor = sceneExecutor;
        this.settings = settings;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public ScriptBreakdown parseScript(Path script) {
        return parseScript(reader.read(script));
    }

    public ScriptBreakdown parseScript(String text) {
        return parseScript(text, settings.defaultOptions());
    }

    /**
     * @param text    the whole script
     * @param options analyzers requested for this run; the configured switches still apply
     * @throws com.eainde.breakdown.exception.NoScenesFoundException if the text has no scene marker
     */
    public ScriptBreakdown parseScript(String text, PipelineOptions options) {
        List<SceneBlock> scenes = splitter.split(text);
        PipelineRun run = runs.open(settings.restrict(options));
        MDC.put(MDC_RUN_ID, run.runId());
        try {
            log.info("Run started: {} scenes, analyzers {}", scenes.size(), run.options().enabled());

            List<SceneOutcome> enriched = extractAndEnrich(run, scenes);

            List<Breakdown> breakdowns = new ArrayList<>();
            List<SceneFailure> failures = new ArrayList<>();
            for (SceneOutcome outcome : enriched) {
                SceneOutcome last = outcome.failed() ? outcome : refine(run, outcome);
                if (last.failed()) {
                    failures.add(last.failure());
                } else {
                    breakdowns.add(last.state().getBreakdown());
                }
            }

            ScriptBreakdown result = new ScriptBreakdown(breakdowns, failures, scenes.size());
            log.info("Run finished: {} scenes refined, {} skipped", result.successCount(), result.failureCount());
            return result;
        } finally {
            runs.close(run.runId());
            MDC.remove(MDC_RUN_ID);
        }
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private List<SceneOutcome> extractAndEnrich(PipelineRun run, List<SceneBlock> scenes) {
        List<SceneOutcome> outcomes = new ArrayList<>(scenes.size());
        int batchSize = settings.sceneBatchSize();
        for (int from = 0; from < scenes.size(); from += batchSize) {
            List<SceneBlock> batch = scenes.subList(from, Math.min(from + batchSize, scenes.size()));
            List<CompletableFuture<SceneOutcome>> futures = batch.stream()
                    .map(scene -> CompletableFuture.supplyAsync(() -> extractAndEnrich(run, scene), sceneExecutor))
                    .collect(Collectors.toList());
            futures.forEach(f -> outcomes.add(f.join()));
        }
        return outcomes;
    }

    private SceneOutcome extractAndEnrich(PipelineRun run, SceneBlock scene) {
        MDC.put(MDC_SCENE, scene.sceneNumber());
        try {
            SceneState state = invoke(Map.of(SceneState.RUN_ID, run.runId(), SceneState.SCENE, scene), run, scene);
            if (state.getStage() == SceneStage.FAILED) {
                log.warn("Scene {} skipped: {}", scene.sceneNumber(), state.getError());
                return SceneOutcome.failed(scene, new SceneFailure(scene.sceneNumber(), SceneStage.EXTRACTED, state.getError()));
            }
            return SceneOutcome.done(scene, state);
        } catch (RuntimeException e) {
            String message = rootMessage(e);
            log.warn("Scene {} skipped during enrichment: {}", scene.sceneNumber(), message);
            return SceneOutcome.failed(scene, new SceneFailure(scene.sceneNumber(), SceneStage.ENRICHED, message));
        } finally {
            MDC.remove(MDC_SCENE);
        }
    }

    private SceneOutcome refine(PipelineRun run, SceneOutcome enriched) {
        SceneBlock scene = enriched.scene();
        MDC.put(MDC_SCENE, scene.sceneNumber());
        try {
            SceneState state = invoke(enriched.state().data(), run, scene);
            if (state.getStage() != SceneStage.REFINED || state.getBreakdown() == null) {
                throw new IllegalStateException("Scene ended in stage " + state.getStage() + " instead of REFINED");
            }
            return SceneOutcome.done(scene, state);
        } catch (RuntimeException e) {
            String message = rootMessage(e);
            log.warn("Scene {} skipped during refinement: {}", scene.sceneNumber(), message);
            return SceneOutcome.failed(scene, new SceneFailure(scene.sceneNumber(), SceneStage.REFINED, message));
        } finally {
            MDC.remove(MDC_SCENE);
        }
    }

    private SceneState invoke(Map<String, Object> inputs, PipelineRun run, SceneBlock scene) {
        RunnableConfig config = RunnableConfig.builder()
                .threadId(run.runId() + "/" + scene.sceneNumber())
                .build();
        return sceneWorkflow.invoke(inputs, config)
                .orElseThrow(() -> new IllegalStateException("Scene workflow returned no state"));
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /** Where one scene stands after a graph run: a state, or the reason it was dropped. */
    private record SceneOutcome(SceneBlock scene, SceneState state, SceneFailure failure) {

        static SceneOutcome done(SceneBlock scene, SceneState state) {
            return new SceneOutcome(scene, state, null);
        }

        static SceneOutcome failed(SceneBlock scene, SceneFailure failure) {
            return new SceneOutcome(scene, null, failure);
        }

        boolean failed() {
            return failure != null;
        }
    }
}
