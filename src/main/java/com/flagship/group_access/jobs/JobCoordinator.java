package com.flagship.group_access.jobs;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.lifecycle.LifecycleScheduler;
import com.flagship.group_access.lifecycle.LifecycleTransition;
import com.flagship.group_access.observability.CorrelationContext;
import com.flagship.group_access.reconciliation.ReconciliationEngine;
import com.flagship.group_access.reconciliation.ReconciliationResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Entry point for the reconciliation and sweep jobs, whether triggered over HTTP or on a schedule.
 * Each run holds the job's lease for its duration and renews it at every heartbeat the job
 * reports (per ledger page, per sweep pass). A renewal that finds the lease gone stops the run.
 */
@Service
@Slf4j
public class JobCoordinator {

    public static final String RECONCILIATION = "reconciliation";
    public static final String SWEEP = "lifecycle-sweep";

    private final JobLeaseService leaseService;
    private final ReconciliationEngine reconciliationEngine;
    private final LifecycleScheduler lifecycleScheduler;
    private final MembershipProperties properties;
    private final Clock clock;
    private final String instanceId;

    public JobCoordinator(JobLeaseService leaseService,
                          ReconciliationEngine reconciliationEngine,
                          LifecycleScheduler lifecycleScheduler,
                          MembershipProperties properties,
                          Clock clock) {
        this.leaseService = leaseService;
        this.reconciliationEngine = reconciliationEngine;
        this.lifecycleScheduler = lifecycleScheduler;
        this.properties = properties;
        this.clock = clock;
        this.instanceId = hostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * A lost lease fails the run without moving the cursor.
     *
     * @throws JobAlreadyRunningException if another run holds the lease
     */
    public ReconciliationResult runReconciliation() {
        return underLease(RECONCILIATION, heartbeat -> reconciliationEngine.run(heartbeat));
    }

    /**
     * @throws JobAlreadyRunningException if another run holds the lease
     * @throws JobLeaseLostException if the lease could not be renewed between passes
     */
    public SweepResult runSweep() {
        return underLease(SWEEP, heartbeat -> {
            Instant now = clock.instant();
            List<LifecycleTransition> transitions = lifecycleScheduler.sweep(now, heartbeat);
            return new SweepResult(now, transitions);
        });
    }

    private <T> T underLease(String jobName, Function<Runnable, T> job) {
        if (!leaseService.tryAcquire(jobName, instanceId, properties.getJobs().getLeaseTtl(), clock.instant())) {
            String owner = leaseService.currentOwner(jobName).orElse("unknown");
            log.info("Job {} skipped, lease held by {}", jobName, owner);
            throw new JobAlreadyRunningException(jobName, owner);
        }

        MDC.put(CorrelationContext.JOB_MDC_KEY, jobName);
        if (MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY) == null) {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        }
        Runnable heartbeat = () -> {
            if (!leaseService.renew(jobName, instanceId, properties.getJobs().getLeaseTtl(), clock.instant())) {
                throw new JobLeaseLostException(jobName, instanceId);
            }
        };
        try {
            return job.apply(heartbeat);
        } finally {
            leaseService.release(jobName, instanceId);
            MDC.remove(CorrelationContext.JOB_MDC_KEY);
        }
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
