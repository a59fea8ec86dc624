package com.flagship.group_access.access;

import com.flagship.group_access.config.MembershipProperties;
import com.flagship.group_access.observability.CorrelationContext;
import com.flagship.group_access.observability.MembershipMetrics;
import com.flagship.group_access.subscription.SubscriptionLedger;
import com.flagship.group_access.user.UserService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns paid access in the ledger into a confirmed grant on the platform.
 *
 * Retry protocol:
 * - Retryable failures consume one slot of the backoff schedule and reschedule the task
 * - Fatal failures end the task as FAILED right away
 * - A used-up schedule ends the task as EXHAUSTED, reported as PENDING
 * - A user without valid paid access is refused with NO_ACTIVE_ACCESS
 *
 * Waiting between attempts is done by {@link AccessFinalizationWorker} polling due tasks,
 * never by a sleeping thread, so ingestion is not held up by one member's backoff.
 */
@Service
@Slf4j
public class AccessFinalizer {

    private final AccessGrantTaskService taskService;
    private final SubscriptionLedger ledger;
    private final GroupAccessPlatform platform;
    private final UserService userService;
    private final MembershipMetrics metrics;
    private final MembershipProperties properties;
    private final Clock clock;
    private final BackoffSchedule schedule;

    public AccessFinalizer(AccessGrantTaskService taskService,
                           SubscriptionLedger ledger,
                           GroupAccessPlatform platform,
                           UserService userService,
                           MembershipMetrics metrics,
                           MembershipProperties properties,
                           Clock clock) {
        this.taskService = taskService;
        this.ledger = ledger;
        this.platform = platform;
        this.userService = userService;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.schedule = new BackoffSchedule(properties.getAccess().getBackoff());
    }

    /**
     * Queues a grant in the caller's transaction. The worker picks it up once the caller commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void requestFinalization(long userId) {
        taskService.restart(userId, clock.instant());
    }

    /**
     * Queues a grant only when nothing is in flight or the previous schedule ran out.
     * Used for duplicate deliveries, which must not undo a grant that already succeeded.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void requestFinalizationIfIdle(long userId) {
        boolean idle = taskService.find(userId)
            .map(task -> task.getStatus() == AccessGrantStatus.EXHAUSTED)
            .orElse(true);
        if (idle) {
            requestFinalization(userId);
        }
    }

    /**
     * Starts a fresh schedule and makes the first attempt now.
     */
    public FinalizationResult finalize(long userId) {
        Instant now = clock.instant();
        AccessGrantTask task = taskService.restartNow(userId, now.plus(properties.getAccess().getClaimLease()));
        return attempt(task);
    }

    /**
     * Runs one attempt for a task the worker has claimed.
     */
    public FinalizationResult attemptClaimed(long userId) {
        return taskService.find(userId)
            .filter(task -> !task.isTerminal())
            .map(this::attempt)
            .orElseGet(() -> FinalizationResult.failed("NO_PENDING_TASK"));
    }

    private FinalizationResult attempt(AccessGrantTask task) {
        long userId = task.getUserId();
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, String.valueOf(userId));
        try {
            Instant now = clock.instant();
            if (!ledger.hasActiveAccess(userId, now)) {
                log.info("Access grant refused, no valid subscription: userId={}", userId);
                metrics.recordAccessAttempt("no_active_access");
                taskService.save(task, task.failed(FinalizationResult.NO_ACTIVE_ACCESS, now));
                return FinalizationResult.failed(FinalizationResult.NO_ACTIVE_ACCESS);
            }

            AccessGrantTask outcome;
            try {
                platform.grantAccess(userId);
                outcome = task.granted(clock.instant());
                metrics.recordAccessAttempt("granted");
                log.info("Access granted: userId={}, attempt={}", userId, outcome.getAttemptCount());
            } catch (PlatformCallException e) {
                outcome = handleFailure(task, e);
            }

            return FinalizationResult.from(taskService.save(task, outcome));
        } finally {
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    private AccessGrantTask handleFailure(AccessGrantTask task, PlatformCallException e) {
        long userId = task.getUserId();
        Instant now = clock.instant();
        String error = e.getErrorCode() != null ? e.getErrorCode() : e.getMessage();

        if (!e.isRetryable()) {
            metrics.recordAccessAttempt("fatal");
            log.warn("Access grant failed permanently: userId={}, error={}, message={}",
                    userId, error, e.getMessage());
            if (PlatformCallException.USER_DEACTIVATED.equals(e.getErrorCode())) {
                userService.deactivate(userId);
            }
            return task.failed(error, now);
        }

        AccessGrantTask next = task.retryLater(error, e.getRetryAfter(), schedule, now);
        if (next.getStatus() == AccessGrantStatus.EXHAUSTED) {
            metrics.recordAccessAttempt("exhausted");
            log.warn("Access grant retries exhausted after {} attempts ({} retries over {}), member must use " +
                    "self-service recovery: userId={}, lastError={}",
                    next.getAttemptCount(), schedule.maxRetries(), schedule.totalDelay(), userId, error);
        } else {
            metrics.recordAccessAttempt("retry");
            log.info("Access grant failed, retrying: userId={}, attempt={}/{}, nextAttemptAt={}, error={}",
                    userId, next.getAttemptCount(), schedule.maxRetries(), next.getNextAttemptAt(), error);
        }
        return next;
    }
}
