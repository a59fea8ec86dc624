package com.flagship.group_access.jobs;

import com.flagship.group_access.observability.CorrelationContext;
import com.flagship.group_access.reconciliation.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process triggers for the jobs. Off by default; deployments usually call the job
 * endpoints from an external scheduler instead.
 */
@Component
@ConditionalOnProperty(name = "jobs.scheduling.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ScheduledJobs {

    private final JobCoordinator coordinator;

    @Scheduled(fixedDelayString = "${jobs.scheduling.sweep-interval-ms:60000}",
               initialDelayString = "${jobs.scheduling.initial-delay-ms:30000}")
    public void sweep() {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        try {
            coordinator.runSweep();
        } catch (JobAlreadyRunningException e) {
            log.debug(e.getMessage());
        } catch (JobLeaseLostException e) {
            log.warn("Scheduled sweep stopped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled sweep failed", e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    @Scheduled(fixedDelayString = "${jobs.scheduling.reconciliation-interval-ms:900000}",
               initialDelayString = "${jobs.scheduling.initial-delay-ms:30000}")
    public void reconcile() {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        try {
            ReconciliationResult result = coordinator.runReconciliation();
            if (result.getStatus() == ReconciliationResult.Status.FAILED) {
                log.warn("Scheduled reconciliation failed: {}", result.getError());
            }
        } catch (JobAlreadyRunningException e) {
            log.debug(e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled reconciliation crashed", e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }
}
