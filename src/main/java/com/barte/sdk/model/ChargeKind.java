package com.barte.sdk.model;

/** Variant tag of a {@link Charge}, selected from its payment method. */
public enum ChargeKind {
    STANDARD,
    PIX;

    public static ChargeKind of(PaymentMethod method) {
        return method == PaymentMethod.PIX ? PIX : STANDARD;
    }
}
