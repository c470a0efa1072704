package com.barte.sdk.client;

/** Thrown when a client is configured with an unknown environment or a missing API key. */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
