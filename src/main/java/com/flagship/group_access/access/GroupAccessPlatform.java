package com.flagship.group_access.access;

import java.time.Duration;

/**
 * Membership operations on the external group platform.
 *
 * All methods throw {@link PlatformCallException} on failure.
 */
public interface GroupAccessPlatform {

    /**
     * Admits the user, typically by approving their pending join request.
     * Admitting a user who is already a member succeeds.
     */
    void grantAccess(long userId);

    /**
     * Removes the user and lets them request to join again later.
     */
    void revokeAccess(long userId);

    /**
     * Mints a single-use invite link that stops working after {@code ttl}.
     *
     * @return the link URL
     */
    String createInviteLink(long userId, Duration ttl);

    /**
     * Tells the platform to stop charging a recurring subscription.
     */
    void stopRecurringCharges(long userId, String chargeId);
}
