package com.eainde.breakdown.job;

import com.eainde.breakdown.model.ScriptBreakdown;

import java.time.Instant;

/**
 * A job as held by the {@link JobManager}. Only the manager changes it, under its lock.
 */
public class AnalysisJob {

    private final String id;
    private final AnalysisRequest request;
    private final String cacheKey;
    private final Instant createdAt;

    private JobStatus status;
    private Instant startedAt;
    private Instant finishedAt;
    private ScriptBreakdown result;
    private String error;
    private boolean fromCache;

    AnalysisJob(String id, AnalysisRequest request, String cacheKey, Instant createdAt) {
        this.id = id;
        this.request = request;
        this.cacheKey = cacheKey;
        this.createdAt = createdAt;
        this.status = JobStatus.PENDING;
    }

    public String getId() { return id; }
    public AnalysisRequest getRequest() { return request; }
    public JobPriority getPriority() { return request.priority(); }
    public AnalysisComponent getComponent() { return request.component(); }
    public String getCacheKey() { return cacheKey; }
    public Instant getCreatedAt() { return createdAt; }
    public JobStatus getStatus() { return status; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public ScriptBreakdown getResult() { return result; }
    public String getError() { return error; }
    public boolean isFromCache() { return fromCache; }

    void setStatus(JobStatus status) { this.status = status; }
    void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    void setResult(ScriptBreakdown result) { this.result = result; }
    void setError(String error) { this.error = error; }
    void setFromCache(boolean fromCache) { this.fromCache = fromCache; }
}
