package com.flagship.group_access.subscription;

import com.flagship.group_access.subscription.dto.SubscriptionStatusResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status and cancellation for the user-facing bot commands. Unknown users answer 404.
 */
@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
@Slf4j
public class SubscriptionController {

    private final SubscriptionLedger ledger;

    @GetMapping("/{userId}")
    public SubscriptionStatusResponse getStatus(@PathVariable("userId") long userId) {
        return SubscriptionStatusResponse.from(ledger.getStatus(userId));
    }

    /**
     * Turns off renewal. Access lasts until the paid window and grace run out.
     */
    @PostMapping("/{userId}/cancel")
    public SubscriptionStatusResponse cancel(@PathVariable("userId") long userId) {
        log.info("Cancel requested: userId={}", userId);
        return SubscriptionStatusResponse.from(ledger.cancel(userId));
    }
}
