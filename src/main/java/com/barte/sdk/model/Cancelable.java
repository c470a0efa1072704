package com.barte.sdk.model;

import java.io.IOException;

/** An entity that can ask the server to cancel itself. */
public interface Cancelable {
    void cancel() throws IOException, InterruptedException;
}
