package com.gaia.config;

/**
 * Root configuration.
 *
 * @param name      Instance name, used in log lines
 * @param scheduler Scheduler settings
 * @param executor  Remote executor settings
 */
public record GaiaConfig(
        String name,
        SchedulerConfig scheduler,
        RemoteExecutorConfig executor
) {
    /**
     * Defaults for all sections.
     */
    public static GaiaConfig defaults() {
        return new GaiaConfig("gaia-scheduler", SchedulerConfig.defaults(), RemoteExecutorConfig.defaults());
    }
}
