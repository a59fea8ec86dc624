package com.flagship.group_access.subscription;

/**
 * Progress of removing an expired member from the group.
 */
public enum RevocationStatus {
    NOT_REQUIRED,
    PENDING,
    DONE,
    SKIPPED_EXEMPT,
    GAVE_UP,
    /** The member paid again before removal went through; nothing is removed. */
    SUPERSEDED
}
