package com.barte.sdk.model;

/**
 * Thrown when a convenience method such as {@link Charge#refund()} is called on an
 * entity that was decoded without a client to act through.
 */
public class UninitializedClientException extends IllegalStateException {

    public UninitializedClientException(String entity) {
        super(entity + " is not bound to a client; obtain it from a BarteClient or call withClient(..) first");
    }
}
