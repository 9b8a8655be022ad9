package com.eainde.breakdown.workflow.nodes;

import com.eainde.breakdown.continuity.ContinuityGraph;
import com.eainde.breakdown.model.Breakdown;
import com.eainde.breakdown.model.SceneStage;
import com.eainde.breakdown.model.WardrobeSpec;
import com.eainde.breakdown.workflow.PipelineRunRegistry;
import com.eainde.breakdown.workflow.state.SceneState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Pass 3: continuity against the scenes refined before this one, then registration.
 * Must run in document order.
 */
@Component
public class RefineSceneNode implements AsyncNodeAction<SceneState> {

    private static final Logger log = LoggerFactory.getLogger(RefineSceneNode.class);

    private final PipelineRunRegistry runs;

    public RefineSceneNode(PipelineRunRegistry runs) {
        this.runs = runs;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SceneState state) {
        ContinuityGraph graph = runs.get(state.getRunId()).continuity();
        Breakdown draft = state.getBreakdown();
        if (draft == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No draft breakdown to refine"));
        }

        Optional<String> previous = graph.detectContinuation(draft);
        Breakdown linked = draft.toBuilder()
                .continuation(previous.isPresent())
                .previousSceneRef(previous.orElse(null))
                .build();

        List<String> notes = graph.continuityNotes(linked);
        List<WardrobeSpec> wardrobe = linked.wardrobe().stream()
                .map(spec -> graph.wardrobeNote(spec.character(), linked).map(spec::withContinuityNote).orElse(spec))
                .collect(Collectors.toList());

        Breakdown refined = linked.toBuilder()
                .continuityNotes(notes)
                .wardrobe(wardrobe)
                .build();
        graph.register(refined);

        previous.ifPresent(p -> log.debug("Scene {} continues scene {}", refined.sceneNumber(), p));
        return CompletableFuture.completedFuture(Map.of(
                SceneState.BREAKDOWN, refined,
                SceneState.STAGE, SceneStage.REFINED));
    }
}
