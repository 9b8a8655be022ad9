package com.eainde.breakdown.workflow.state;

import com.eainde.breakdown.model.Breakdown;
import com.eainde.breakdown.model.SceneStage;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;

/**
 * Graph state of one scene. Every value is serialisable; run-scoped collaborators are
 * reached through {@link #getRunId()}.
 */
public class SceneState extends AgentState {

    public static final String RUN_ID = "runId";
    public static final String SCENE = "scene";
    public static final String STAGE = "stage";
    public static final String HEADER = "header";
    public static final String SCENE_TYPE = "sceneType";
    public static final String RAW_CAST = "rawCast";
    public static final String BREAKDOWN = "breakdown";
    public static final String ERROR = "error";

    public SceneState(Map<String, Object> initData) {
        super(initData);
    }

    public String getRunId() { return (String) this.data().get(RUN_ID); }
    public SceneBlock getScene() { return (SceneBlock) this.data().get(SCENE); }

    /** Null until the extraction pass has run. */
    public SceneStage getStage() { return (SceneStage) this.data().get(STAGE); }

    public SceneHeader getHeader() { return (SceneHeader) this.data().get(HEADER); }
    public SceneType getSceneType() { return (SceneType) this.data().get(SCENE_TYPE); }

    @SuppressWarnings("unchecked")
    public List<String> getRawCast() {
        return this.data().containsKey(RAW_CAST) ? (List<String>) this.data().get(RAW_CAST) : List.of();
    }

    public Breakdown getBreakdown() { return (Breakdown) this.data().get(BREAKDOWN); }
    public String getError() { return (String) this.data().get(ERROR); }

    public static Map<String, Object> failed(String error) {
        return Map.of(STAGE, SceneStage.FAILED, ERROR, error);
    }
}
