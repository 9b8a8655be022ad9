package com.eainde.breakdown.job;

import com.eainde.breakdown.model.ScriptBreakdown;
import com.eainde.breakdown.workflow.SceneParser;
import org.springframework.stereotype.Component;

/**
 * Runs the scene pipeline with the analyzers of the requested component.
 */
@Component
public class BreakdownJobProcessor implements JobProcessor {

    private final SceneParser sceneParser;

    public BreakdownJobProcessor(SceneParser sceneParser) {
        this.sceneParser = sceneParser;
    }

    @Override
    public ScriptBreakdown process(AnalysisRequest request) {
        return sceneParser.parseScript(request.text(), request.component().options());
    }
}
