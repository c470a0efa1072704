package com.barte.sdk.model;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Thrown by {@link Order#refund(boolean)} and {@link Order#cancel()} when at least one
 * charge of the order failed. Every charge is still attempted; the charges that
 * went through are reported alongside the failures, keyed by charge uuid.
 * The first failure is the cause, the rest are suppressed.
 */
public class OrderChargesException extends IOException {

    private final String orderUuid;
    private final List<String> completedCharges;
    private final List<Refund> refunds;
    private final Map<String, IOException> failures;

    public OrderChargesException(String orderUuid, List<String> completedCharges, List<Refund> refunds,
                                 Map<String, IOException> failures) {
        super(failures.size() + " of " + (completedCharges.size() + failures.size())
                + " charges of order " + orderUuid + " failed: " + failures.keySet());
        this.orderUuid = orderUuid;
        this.completedCharges = Collections.unmodifiableList(completedCharges);
        this.refunds = Collections.unmodifiableList(refunds);
        this.failures = Collections.unmodifiableMap(failures);
        boolean first = true;
        for (IOException failure : failures.values()) {
            if (first) {
                initCause(failure);
                first = false;
            } else {
                addSuppressed(failure);
            }
        }
    }

    public String getOrderUuid() {
        return orderUuid;
    }

    /** Uuids of the charges that were refunded or canceled, in order. */
    public List<String> getCompletedCharges() {
        return completedCharges;
    }

    /** Refunds that succeeded; empty for a cancellation. */
    public List<Refund> getRefunds() {
        return refunds;
    }

    public Map<String, IOException> getFailures() {
        return failures;
    }
}
