package com.flagship.group_access.subscription;

public class SubscriptionNotFoundException extends RuntimeException {

    private final long userId;

    public SubscriptionNotFoundException(long userId) {
        super("No subscription for user " + userId);
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
