package com.flagship.group_access.access;

import com.flagship.group_access.config.MembershipProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Self-service path for a paying member who is not in the group.
 *
 * 1. Refuse if the ledger shows no valid access
 * 2. Try the normal grant again
 * 3. If that does not admit them (no join request, retries used up), mint a single-use invite link
 *
 * Covers every case where automated finalization gave up, so a paying member always has a way in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessRecoveryService {

    private final AccessFinalizer finalizer;
    private final GroupAccessPlatform platform;
    private final MembershipProperties properties;
    private final Clock clock;

    public RecoveryResult enter(long userId) {
        FinalizationResult result = finalizer.finalize(userId);

        if (result.getOutcome() == FinalizationResult.Outcome.GRANTED) {
            return RecoveryResult.granted();
        }
        if (FinalizationResult.NO_ACTIVE_ACCESS.equals(result.getReason())) {
            return RecoveryResult.noActiveAccess();
        }

        Duration ttl = properties.getAccess().getInviteTtl();
        Instant expiresAt = clock.instant().plus(ttl);
        try {
            String link = platform.createInviteLink(userId, ttl);
            log.info("Invite link issued: userId={}, finalization={}, reason={}, expiresAt={}",
                    userId, result.getOutcome(), result.getReason(), expiresAt);
            return RecoveryResult.inviteLink(link, expiresAt);
        } catch (PlatformCallException e) {
            log.warn("Invite link creation failed: userId={}, kind={}, error={}",
                    userId, e.getKind(), e.getMessage());
            return RecoveryResult.unavailable(e.getErrorCode() != null ? e.getErrorCode() : e.getMessage());
        }
    }
}
