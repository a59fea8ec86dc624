package com.flagship.group_access.jobs;

/**
 * The lease ran out mid-run and could not be renewed, so another instance may already be running
 * the same job. The current run stops at the next renewal point.
 */
public class JobLeaseLostException extends RuntimeException {

    private final String jobName;

    public JobLeaseLostException(String jobName, String owner) {
        super(String.format("Lease for job %s is no longer held by %s", jobName, owner));
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
