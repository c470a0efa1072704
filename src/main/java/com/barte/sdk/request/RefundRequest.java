package com.barte.sdk.request;

/** Body of {@code PATCH /charges/{uuid}/refund}. */
public class RefundRequest {
    public boolean asFraud;

    /** Default constructor for Jackson. */
    public RefundRequest() {}

    public RefundRequest(boolean asFraud) {
        this.asFraud = asFraud;
    }
}
