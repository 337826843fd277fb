package com.gaia.adapter.spring;

import com.gaia.adapter.agent.SchedulerIntegration;
import com.gaia.adapter.executor.RemoteTestExecutor;
import com.gaia.adapter.executor.TimeoutTestExecutor;
import com.gaia.config.ConfigLoader;
import com.gaia.config.GaiaConfig;
import com.gaia.core.TestExecutor;
import com.gaia.scheduler.AdaptiveScheduler;
import com.gaia.scheduler.DefaultAdaptiveScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring Boot auto-configuration for the GAIA scheduler.
 */
@Configuration
@ConditionalOnProperty(prefix = "gaia", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(GaiaProperties.class)
public class GaiaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GaiaAutoConfiguration.class);

    private AutoCloseable remoteExecutor;

    @Bean
    @ConditionalOnMissingBean
    public GaiaConfig gaiaConfig(GaiaProperties properties) {
        log.info("Loading GAIA configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public AdaptiveScheduler adaptiveScheduler(GaiaConfig config) {
        log.info("Creating AdaptiveScheduler: {}", config.name());
        return new DefaultAdaptiveScheduler(config.scheduler());
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public TestExecutor testExecutor(GaiaConfig config) {
        log.info("Creating remote TestExecutor for {}", config.executor().hostUrl());
        TimeoutTestExecutor executor = new TimeoutTestExecutor(
                new RemoteTestExecutor(config.executor()),
                Duration.ofSeconds(config.executor().executionTimeoutSeconds()));
        this.remoteExecutor = executor;
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerIntegration schedulerIntegration(AdaptiveScheduler scheduler, TestExecutor executor) {
        return new SchedulerIntegration(scheduler, executor);
    }

    @PreDestroy
    public void shutdown() {
        if (remoteExecutor != null) {
            log.info("Closing remote TestExecutor");
            try {
                remoteExecutor.close();
            } catch (Exception e) {
                log.warn("Failed to close remote TestExecutor", e);
            }
        }
    }
}
