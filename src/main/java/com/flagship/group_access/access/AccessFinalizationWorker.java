package com.flagship.group_access.access;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Polls for access grant tasks whose next attempt is due and runs them.
 */
@Component
@ConditionalOnProperty(name = "access.worker.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AccessFinalizationWorker {

    private final AccessGrantTaskService taskService;
    private final AccessFinalizer finalizer;
    private final MembershipProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${access.worker.poll-interval-ms:500}")
    public void processDueTasks() {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        MDC.put(CorrelationContext.JOB_MDC_KEY, "access-finalization");
        try {
            List<Long> userIds = taskService.claimDue(clock.instant(), properties.getAccess().getWorkerBatchSize());
            if (userIds.isEmpty()) {
                return;
            }
            log.debug("Claimed {} due access grant tasks", userIds.size());

            for (Long userId : userIds) {
                try {
                    finalizer.attemptClaimed(userId);
                } catch (Exception e) {
                    // Task stays claimed until its lease ends, then it is picked up again.
                    log.error("Access grant attempt crashed: userId={}", userId, e);
                }
            }
        } catch (Exception e) {
            log.error("Error in access finalization polling loop", e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.JOB_MDC_KEY);
        }
    }
}
