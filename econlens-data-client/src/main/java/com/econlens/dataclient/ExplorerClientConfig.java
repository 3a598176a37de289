package com.econlens.dataclient;

/**
 * Connection settings for the explorer backend.
 */
public class ExplorerClientConfig {
    private static final String DEFAULT_BASE_URL = "http://localhost:8000";
    private static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
    private static final int DEFAULT_READ_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_WRITE_TIMEOUT_SECONDS = 30;

    private final String baseUrl;
    private final String apiToken;
    private final int connectTimeoutSeconds;
    private final int readTimeoutSeconds;
    private final int writeTimeoutSeconds;

    public ExplorerClientConfig(String baseUrl, String apiToken, int connectTimeoutSeconds, int readTimeoutSeconds,
                                int writeTimeoutSeconds) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL is required");
        }
        if (connectTimeoutSeconds < 1 || readTimeoutSeconds < 1 || writeTimeoutSeconds < 1) {
            throw new IllegalArgumentException("Timeouts must be positive");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiToken = apiToken == null || apiToken.isBlank() ? null : apiToken;
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        this.readTimeoutSeconds = readTimeoutSeconds;
        this.writeTimeoutSeconds = writeTimeoutSeconds;
    }

    public ExplorerClientConfig(String baseUrl, String apiToken, int connectTimeoutSeconds, int readTimeoutSeconds) {
        this(baseUrl, apiToken, connectTimeoutSeconds, readTimeoutSeconds, DEFAULT_WRITE_TIMEOUT_SECONDS);
    }

    public ExplorerClientConfig(String baseUrl) {
        this(baseUrl, null, DEFAULT_CONNECT_TIMEOUT_SECONDS, DEFAULT_READ_TIMEOUT_SECONDS);
    }

    public static ExplorerClientConfig load() {
        // System properties win over environment, then defaults
        String baseUrl = System.getProperty("econlens.api.url",
            System.getenv().getOrDefault("ECONLENS_API_URL", DEFAULT_BASE_URL));

        String token = System.getProperty("econlens.api.token",
            System.getenv().get("ECONLENS_API_TOKEN"));

        int connectTimeout = Integer.parseInt(System.getProperty("econlens.api.connect_timeout",
            System.getenv().getOrDefault("ECONLENS_CONNECT_TIMEOUT", String.valueOf(DEFAULT_CONNECT_TIMEOUT_SECONDS))));

        int readTimeout = Integer.parseInt(System.getProperty("econlens.api.read_timeout",
            System.getenv().getOrDefault("ECONLENS_READ_TIMEOUT", String.valueOf(DEFAULT_READ_TIMEOUT_SECONDS))));

        int writeTimeout = Integer.parseInt(System.getProperty("econlens.api.write_timeout",
            System.getenv().getOrDefault("ECONLENS_WRITE_TIMEOUT", String.valueOf(DEFAULT_WRITE_TIMEOUT_SECONDS))));

        return new ExplorerClientConfig(baseUrl, token, connectTimeout, readTimeout, writeTimeout);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Bearer token, or null when requests go unauthenticated.
     */
    public String getApiToken() {
        return apiToken;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public int getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    public int getWriteTimeoutSeconds() {
        return writeTimeoutSeconds;
    }
}
