package com.eainde.breakdown.workflow.edges;

import com.eainde.breakdown.model.SceneStage;
import com.eainde.breakdown.workflow.state.SceneState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Routes a fresh scene to extraction and an enriched scene to refinement, so the two
 * halves of the pipeline can be driven separately.
 */
@Component
public class SceneEntryEdge implements AsyncEdgeAction<SceneState> {

    public static final String EXTRACT = "extract";
    public static final String REFINE = "refine";
    public static final String DONE = "done";

    @Override
    public CompletableFuture<String> apply(SceneState state) {
        SceneStage stage = state.getStage();
        String next;
        if (stage == null) {
            next = EXTRACT;
        } else if (stage == SceneStage.ENRICHED) {
            next = REFINE;
        } else {
            next = DONE;
        }
        return CompletableFuture.completedFuture(next);
    }
}
