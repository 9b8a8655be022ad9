package com.eainde.breakdown.exception;

import com.eainde.breakdown.job.JobStatus;

public class InvalidTransitionException extends BreakdownException {

    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
