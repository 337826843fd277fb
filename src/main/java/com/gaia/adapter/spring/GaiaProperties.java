package com.gaia.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code gaia.*} properties read by {@link GaiaAutoConfiguration}.
 * <p>
 * They only locate the scheduler YAML and switch the wiring on or off. Queue size, batch size,
 * rounds, completion threshold, log file and the remote browser host all live in that YAML.
 */
@ConfigurationProperties(prefix = "gaia")
public class GaiaProperties {

    /**
     * {@code false} skips the scheduler, the remote executor and the integration bean.
     */
    private boolean enabled = true;

    /**
     * Scheduler YAML handed to {@code ConfigLoader}. A {@code classpath:} prefix reads from the
     * classpath, anything else is a file path.
     */
    private String configPath = "classpath:gaia-scheduler.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
