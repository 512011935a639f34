package io.infopulse.ingestion.config;

import java.util.List;

/**
 * @param connectTimeout milliseconds
 * @param readTimeout    milliseconds
 */
public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        List<String> userAgents
) {
    public static final int DEFAULT_TIMEOUT_MS = 30_000;
    public static final String DEFAULT_USER_AGENT = "Infopulse-Node/1.0";

    public HttpConfig {
        if (connectTimeout <= 0) connectTimeout = DEFAULT_TIMEOUT_MS;
        if (readTimeout <= 0) readTimeout = DEFAULT_TIMEOUT_MS;
        userAgents = userAgents == null || userAgents.isEmpty()
                ? List.of(DEFAULT_USER_AGENT)
                : List.copyOf(userAgents);
    }

    public static HttpConfig defaults() {
        return new HttpConfig(0, 0, null);
    }
}
