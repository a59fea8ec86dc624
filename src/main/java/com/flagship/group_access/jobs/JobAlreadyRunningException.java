package com.flagship.group_access.jobs;

/**
 * Another instance holds the lease for this job.
 */
public class JobAlreadyRunningException extends RuntimeException {

    private final String jobName;

    public JobAlreadyRunningException(String jobName, String owner) {
        super(String.format("Job %s is already running on %s", jobName, owner));
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
