package com.flagship.group_access.exemption;

/**
 * Answers whether a member keeps group access regardless of payment state.
 */
public interface ExemptionRegistry {

    boolean isExempt(long userId);
}
