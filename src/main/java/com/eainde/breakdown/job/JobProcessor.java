package com.eainde.breakdown.job;

import com.eainde.breakdown.model.ScriptBreakdown;

/**
 * Does the work of one job. Runs on a job worker thread; an exception fails the job.
 */
public interface JobProcessor {

    ScriptBreakdown process(AnalysisRequest request);
}
