package com.eainde.breakdown.workflow;

import com.eainde.breakdown.continuity.ContinuityGraph;
import com.eainde.breakdown.knowledge.KnowledgeBase;
import com.eainde.breakdown.knowledge.ProfileRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open pipeline runs by id. Graph nodes look their run up here since the graph state only
 * holds serialisable values.
 */
@Component
public class PipelineRunRegistry {

    private final KnowledgeBase knowledgeBase;
    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();

    public PipelineRunRegistry(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    public PipelineRun open(PipelineOptions options) {
        String runId = UUID.randomUUID().toString();
        PipelineRun run = new PipelineRun(runId, new ContinuityGraph(), new ProfileRegistry(knowledgeBase), options);
        runs.put(runId, run);
        return run;
    }

    /**
     * @throws IllegalStateException if the run is not open
     */
    public PipelineRun get(String runId) {
        PipelineRun run = runId == null ? null : runs.get(runId);
        if (run == null) {
            throw new IllegalStateException("No open pipeline run with id " + runId);
        }
        return run;
    }

    public void close(String runId) {
        runs.remove(runId);
    }

    public int openRuns() {
        return runs.size();
    }
}
