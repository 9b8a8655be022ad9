package com.eainde.breakdown.exception;

public class JobNotFoundException extends BreakdownException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("No analysis job with id: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
