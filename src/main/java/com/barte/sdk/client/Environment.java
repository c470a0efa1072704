package com.barte.sdk.client;

/** API environments; each maps to a fixed host. */
public enum Environment {
    PRODUCTION("production", "https://api.barte.com.br"),
    SANDBOX("sandbox", "https://sandbox-api.barte.com.br");

    private final String wireName;
    private final String baseUrl;

    Environment(String wireName, String baseUrl) {
        this.wireName = wireName;
        this.baseUrl = baseUrl;
    }

    public String wireName() {
        return wireName;
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Parses exactly {@code "production"} or {@code "sandbox"}.
     *
     * @throws ConfigurationException for any other value, including other casings or surrounding whitespace
     */
    public static Environment parse(String value) {
        for (Environment environment : values()) {
            if (environment.wireName.equals(value)) {
                return environment;
            }
        }
        throw new ConfigurationException("Invalid environment '" + value + "'. Must be one of: production, sandbox");
    }
}
