package com.flagship.group_access.payment;

/**
 * Which ingestion path first recorded a payment.
 */
public enum PaymentSource {
    LIVE,
    RECONCILIATION
}
