package com.eainde.breakdown.workflow;

import com.eainde.breakdown.workflow.edges.ExtractionOutcomeEdge;
import com.eainde.breakdown.workflow.edges.SceneEntryEdge;
import com.eainde.breakdown.workflow.nodes.EnrichSceneNode;
import com.eainde.breakdown.workflow.nodes.ExtractSceneNode;
import com.eainde.breakdown.workflow.nodes.RefineSceneNode;
import com.eainde.breakdown.workflow.state.SceneState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Per-scene state machine: {@code extract -> enrich} for a fresh scene and {@code refine}
 * for an enriched one. A failed extraction ends the graph.
 *
 * <pre>
 *   START --(fresh)----> extract --(ok)-----> enrich --> END
 *                                 --(failed)-> END
 *   START --(enriched)-> refine --> END
 * </pre>
 */
@Component
public class SceneWorkflowGraph {

    public static final String EXTRACT = "extract";
    public static final String ENRICH = "enrich";
    public static final String REFINE = "refine";

    private final ExtractSceneNode extractNode;
    private final EnrichSceneNode enrichNode;
    private final RefineSceneNode refineNode;
    private final SceneEntryEdge entryEdge;
    private final ExtractionOutcomeEdge extractionOutcomeEdge;

    public SceneWorkflowGraph(ExtractSceneNode extractNode,
                              EnrichSceneNode enrichNode,
                              RefineSceneNode refineNode,
                              SceneEntryEdge entryEdge,
                              ExtractionOutcomeEdge extractionOutcomeEdge) {
        this.extractNode = extractNode;
        this.enrichNode = enrichNode;
        this.refineNode = refineNode;
        this.entryEdge = entryEdge;
        this.extractionOutcomeEdge = extractionOutcomeEdge;
    }

    @Bean("sceneWorkflow")
    public CompiledGraph<SceneState> build() throws GraphStateException {

        StateGraph<SceneState> workflow = new StateGraph<>(SceneState::new);

        workflow.addNode(EXTRACT, extractNode);
        workflow.addNode(ENRICH, enrichNode);
        workflow.addNode(REFINE, refineNode);

        workflow.addConditionalEdges(
                START,
                entryEdge,
                Map.of(
                        SceneEntryEdge.EXTRACT, EXTRACT,
                        SceneEntryEdge.REFINE, REFINE,
                        SceneEntryEdge.DONE, END
                )
        );

        workflow.addConditionalEdges(
                EXTRACT,
                extractionOutcomeEdge,
                Map.of(
                        ExtractionOutcomeEdge.ENRICH, ENRICH,
                        ExtractionOutcomeEdge.FAILED, END
                )
        );

        workflow.addEdge(ENRICH, END);
        workflow.addEdge(REFINE, END);

        return workflow.compile();
    }
}
