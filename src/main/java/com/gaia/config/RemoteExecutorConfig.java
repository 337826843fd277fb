package com.gaia.config;

/**
 * Connection details for the remote browser-automation host.
 *
 * @param hostUrl                 Base URL; requests go to {@code {hostUrl}/execute}
 * @param requestTimeoutSeconds   Timeout for scenario execution requests
 * @param analyzeTimeoutSeconds   Timeout for page analysis requests
 * @param executionTimeoutSeconds Upper bound for one item, enforced around the executor
 */
public record RemoteExecutorConfig(
        String hostUrl,
        int requestTimeoutSeconds,
        int analyzeTimeoutSeconds,
        int executionTimeoutSeconds
) {
    public static final String DEFAULT_HOST_URL = "http://localhost:8001";

    public static RemoteExecutorConfig defaults() {
        return new RemoteExecutorConfig(DEFAULT_HOST_URL, 30, 20, 45);
    }
}
