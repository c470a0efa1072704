package com.barte.sdk.transport;

/** HTTP verbs used by the API. */
public enum HttpMethod {
    GET, POST, PATCH, PUT, DELETE
}
