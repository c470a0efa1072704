package com.barte.sdk.model;

import java.io.IOException;

/** An entity that can ask the server to refund itself. */
public interface Refundable<R> {

    /** Refunds without flagging fraud. */
    R refund() throws IOException, InterruptedException;

    R refund(boolean asFraud) throws IOException, InterruptedException;
}
