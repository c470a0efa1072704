package com.barte.sdk.decode;

import java.io.IOException;

/**
 * Thrown when a successful response cannot be mapped onto the expected entity:
 * a required field is missing, a value has the wrong JSON type, or a timestamp
 * is malformed.
 */
public class DecodingException extends IOException {

    private final String path;

    public DecodingException(String path, String problem) {
        super(message(path, problem));
        this.path = path;
    }

    public DecodingException(String path, String problem, Throwable cause) {
        super(message(path, problem), cause);
        this.path = path;
    }

    /** Dotted path of the offending field, e.g. {@code charges[0].customer.name}; empty for the root. */
    public String getPath() {
        return path;
    }

    private static String message(String path, String problem) {
        return path.isEmpty() ? problem : "Field '" + path + "': " + problem;
    }
}
