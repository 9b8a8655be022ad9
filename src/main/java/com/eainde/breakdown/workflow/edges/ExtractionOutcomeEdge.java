package com.eainde.breakdown.workflow.edges;

import com.eainde.breakdown.model.SceneStage;
import com.eainde.breakdown.workflow.state.SceneState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class ExtractionOutcomeEdge implements AsyncEdgeAction<SceneState> {

    public static final String ENRICH = "enrich";
    public static final String FAILED = "failed";

    @Override
    public CompletableFuture<String> apply(SceneState state) {
        return CompletableFuture.completedFuture(state.getStage() == SceneStage.FAILED ? FAILED : ENRICH);
    }
}
