package com.barte.sdk.transport;

import java.io.IOException;

/**
 * Thrown when the API answers with a non-2xx status. The response body is kept
 * verbatim for diagnostics.
 */
public class RemoteApiException extends IOException {

    private final int statusCode;
    private final String body;

    public RemoteApiException(int statusCode, String body) {
        super("HTTP " + statusCode + ": " + body);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }
}
