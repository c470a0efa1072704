package com.barte.sdk.client;

import java.util.Map;

/** Credentials and environment of a client. Immutable. */
public final class ClientConfig {

    /** Header carrying the API key. */
    public static final String AUTH_HEADER = "X-Token-Api";

    static final String API_KEY_VARIABLE = "BARTE_API_KEY";
    static final String ENVIRONMENT_VARIABLE = "BARTE_ENVIRONMENT";

    private final String apiKey;
    private final Environment environment;

    public ClientConfig(String apiKey, Environment environment) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("API key must not be blank");
        }
        if (environment == null) {
            throw new ConfigurationException("Environment must be one of: production, sandbox");
        }
        this.apiKey = apiKey;
        this.environment = environment;
    }

    /** @throws ConfigurationException if {@code environment} is not "production" or "sandbox" */
    public static ClientConfig of(String apiKey, String environment) {
        return new ClientConfig(apiKey, Environment.parse(environment));
    }

    /** Reads {@code BARTE_API_KEY} and {@code BARTE_ENVIRONMENT} (default production). */
    public static ClientConfig fromEnvironment() {
        return fromVariables(System.getenv());
    }

    static ClientConfig fromVariables(Map<String, String> variables) {
        return of(variables.get(API_KEY_VARIABLE), variables.getOrDefault(ENVIRONMENT_VARIABLE, "production"));
    }

    public String apiKey() {
        return apiKey;
    }

    public Environment environment() {
        return environment;
    }

    public String baseUrl() {
        return environment.baseUrl();
    }

    public String authHeaderName() {
        return AUTH_HEADER;
    }

    public String authHeaderValue() {
        return apiKey;
    }

    @Override
    public String toString() {
        return "ClientConfig{environment=" + environment.wireName() + "}";
    }
}
