package com.eainde.breakdown.workflow.nodes;

import com.eainde.breakdown.analyzer.CastAnalyzer;
import com.eainde.breakdown.exception.SceneParseException;
import com.eainde.breakdown.model.SceneStage;
import com.eainde.breakdown.scene.HeaderParser;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;
import com.eainde.breakdown.scene.SceneTypeClassifier;
import com.eainde.breakdown.workflow.state.SceneState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Pass 1: header, scene type and the raw cast names. A scene whose header cannot be
 * parsed is marked failed instead of failing the graph.
 */
@Component
public class ExtractSceneNode implements AsyncNodeAction<SceneState> {

    private static final Logger log = LoggerFactory.getLogger(ExtractSceneNode.class);

    private final HeaderParser headerParser;
    private final SceneTypeClassifier sceneTypeClassifier;
    private final CastAnalyzer castAnalyzer;

    public ExtractSceneNode(HeaderParser headerParser, SceneTypeClassifier sceneTypeClassifier, CastAnalyzer castAnalyzer) {
        this.headerParser = headerParser;
        this.sceneTypeClassifier = sceneTypeClassifier;
        this.castAnalyzer = castAnalyzer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SceneState state) {
        SceneBlock scene = state.getScene();
        if (scene == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Scene block missing from state"));
        }
        try {
            SceneHeader header = headerParser.parse(scene);
            SceneType sceneType = sceneTypeClassifier.classify(scene.rawText());
            List<String> rawCast = new ArrayList<>(castAnalyzer.extractNames(scene.rawText()));
            log.debug("Scene {} extracted: {} {} '{}', {}, raw cast {}", scene.sceneNumber(),
                    header.interiorExterior(), header.timeOfDay(), header.location(), sceneType, rawCast);

            return CompletableFuture.completedFuture(Map.of(
                    SceneState.HEADER, header,
                    SceneState.SCENE_TYPE, sceneType,
                    SceneState.RAW_CAST, rawCast,
                    SceneState.STAGE, SceneStage.EXTRACTED));
        } catch (SceneParseException e) {
            log.warn("Scene {} could not be extracted: {}", scene.sceneNumber(), e.getMessage());
            return CompletableFuture.completedFuture(SceneState.failed(e.getMessage()));
        }
    }
}
