package com.flagship.group_access.access;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a member asking to be let in.
 */
@Value
public class RecoveryResult {

    public enum Outcome {
        /** Member was admitted directly. */
        GRANTED,
        /** A single-use invite link was minted. */
        INVITE_LINK,
        NO_ACTIVE_ACCESS,
        /** The platform could not be reached; the member should try again shortly. */
        UNAVAILABLE
    }

    Outcome outcome;
    String inviteLink;
    Instant inviteExpiresAt;
    String reason;

    static RecoveryResult granted() {
        return new RecoveryResult(Outcome.GRANTED, null, null, null);
    }

    static RecoveryResult inviteLink(String link, Instant expiresAt) {
        return new RecoveryResult(Outcome.INVITE_LINK, link, expiresAt, null);
    }

    static RecoveryResult noActiveAccess() {
        return new RecoveryResult(Outcome.NO_ACTIVE_ACCESS, null, null, FinalizationResult.NO_ACTIVE_ACCESS);
    }

    static RecoveryResult unavailable(String reason) {
        return new RecoveryResult(Outcome.UNAVAILABLE, null, null, reason);
    }
}
