package com.barte.sdk.model;

/**
 * Lifecycle status of a charge. Transitions are decided by the server; a charge
 * only changes status locally by being fetched again.
 */
public enum ChargeStatus {
    SCHEDULED,
    PENDING,
    PRE_AUTHORIZED,
    AUTHORIZED,
    LATE,
    PAID,
    FAILED,
    CANCELED,
    REFUND,
    PARTIALLY_REFUNDED,
    CHARGEBACK,
    DISPUTE
}
