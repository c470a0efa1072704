package com.barte.sdk.model;

/** Payment methods as named on the wire. */
public enum PaymentMethod {
    PIX,
    BANK_SLIP,
    CREDIT_CARD,
    CREDIT_CARD_EARLY_BUYER,
    CREDIT_CARD_EARLY_SELLER,
    CREDIT_CARD_EARLY_MIXED
}
