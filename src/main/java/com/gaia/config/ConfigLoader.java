package com.gaia.config;

import com.gaia.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads GAIA configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static GaiaConfig load(String path) {
        log.info("Loading GAIA configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from a YAML stream.
     */
    public static GaiaConfig parse(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration is not a valid YAML mapping", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Settings may sit at root or under a 'gaia' key
        Map<String, Object> gaia = root.containsKey("gaia")
                ? section(root, "gaia")
                : root;

        String name = getString(gaia, "name", "gaia-scheduler");
        SchedulerConfig scheduler = parseSchedulerConfig(section(gaia, "scheduler"));
        RemoteExecutorConfig executor = parseExecutorConfig(section(gaia, "executor"));

        GaiaConfig config = new GaiaConfig(name, scheduler, executor);

        log.info("Loaded GAIA configuration: {} (queue={}, topN={}, rounds={}, threshold={}, host={})",
                name, scheduler.maxQueueSize(), scheduler.topNExecution(), scheduler.maxRounds(),
                scheduler.completionThreshold(), executor.hostUrl());

        return config;
    }

    private static SchedulerConfig parseSchedulerConfig(Map<String, Object> map) {
        if (map == null) {
            return SchedulerConfig.defaults();
        }

        int maxQueueSize = getInt(map, "max-queue-size", SchedulerConfig.DEFAULT_MAX_QUEUE_SIZE);
        int topN = getInt(map, "top-n-execution", SchedulerConfig.DEFAULT_TOP_N_EXECUTION);
        int maxRounds = getInt(map, "max-rounds", SchedulerConfig.DEFAULT_MAX_ROUNDS);
        double threshold = getDouble(map, "completion-threshold", SchedulerConfig.DEFAULT_COMPLETION_THRESHOLD);
        String logFile = getString(map, "log-file", SchedulerConfig.DEFAULT_LOG_FILE);

        requireAtLeast("scheduler.max-queue-size", maxQueueSize, 1);
        requireAtLeast("scheduler.top-n-execution", topN, 1);
        requireAtLeast("scheduler.max-rounds", maxRounds, 1);
        if (threshold < 0.0 || threshold > 1.0) {
            throw new ConfigurationException(
                    "scheduler.completion-threshold must be between 0.0 and 1.0, got " + threshold);
        }
        if (logFile.isBlank()) {
            throw new ConfigurationException("scheduler.log-file must not be blank");
        }

        return new SchedulerConfig(maxQueueSize, topN, maxRounds, threshold, logFile);
    }

    private static RemoteExecutorConfig parseExecutorConfig(Map<String, Object> map) {
        if (map == null) {
            return RemoteExecutorConfig.defaults();
        }
        RemoteExecutorConfig defaults = RemoteExecutorConfig.defaults();

        String hostUrl = getString(map, "host-url", defaults.hostUrl());
        int requestTimeout = getInt(map, "request-timeout-seconds", defaults.requestTimeoutSeconds());
        int analyzeTimeout = getInt(map, "analyze-timeout-seconds", defaults.analyzeTimeoutSeconds());
        int executionTimeout = getInt(map, "execution-timeout-seconds", defaults.executionTimeoutSeconds());

        if (hostUrl.isBlank()) {
            throw new ConfigurationException("executor.host-url must not be blank");
        }
        requireAtLeast("executor.request-timeout-seconds", requestTimeout, 1);
        requireAtLeast("executor.analyze-timeout-seconds", analyzeTimeout, 1);
        requireAtLeast("executor.execution-timeout-seconds", executionTimeout, 1);

        // Trailing slash would produce '//execute'
        if (hostUrl.endsWith("/")) {
            hostUrl = hostUrl.substring(0, hostUrl.length() - 1);
        }

        return new RemoteExecutorConfig(hostUrl, requestTimeout, analyzeTimeout, executionTimeout);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static void requireAtLeast(String key, int value, int min) {
        if (value < min) {
            throw new ConfigurationException(key + " must be at least " + min + ", got " + value);
        }
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got: " + value, e);
        }
    }
}
