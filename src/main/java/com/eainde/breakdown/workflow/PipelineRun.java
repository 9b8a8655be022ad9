package com.eainde.breakdown.workflow;

import com.eainde.breakdown.continuity.ContinuityGraph;
import com.eainde.breakdown.knowledge.ProfileRegistry;

/**
 * Mutable per-run collaborators that cannot travel inside the graph state.
 *
 * @param runId      id carried in the scene state and the MDC
 * @param continuity the run's continuity graph
 * @param profiles   the run's character profiles
 * @param options    analyzers enabled for the run
 */
public record PipelineRun(String runId, ContinuityGraph continuity, ProfileRegistry profiles, PipelineOptions options) {
}
