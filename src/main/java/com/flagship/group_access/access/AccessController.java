package com.flagship.group_access.access;

import com.flagship.group_access.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/access")
@RequiredArgsConstructor
@Slf4j
public class AccessController {

    private final AccessRecoveryService recoveryService;

    /**
     * Re-checks the member's subscription and lets them in, directly or through an invite link.
     * 403 when there is nothing paid to recover, 503 when the platform is unreachable.
     */
    @PostMapping("/{userId}/enter")
    public ResponseEntity<RecoveryResult> enter(@PathVariable("userId") long userId) {
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, String.valueOf(userId));
        try {
            RecoveryResult result = recoveryService.enter(userId);
            log.info("Access recovery requested: userId={}, outcome={}", userId, result.getOutcome());
            HttpStatus status = switch (result.getOutcome()) {
                case GRANTED, INVITE_LINK -> HttpStatus.OK;
                case NO_ACTIVE_ACCESS -> HttpStatus.FORBIDDEN;
                case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            };
            return ResponseEntity.status(status).body(result);
        } finally {
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }
}
