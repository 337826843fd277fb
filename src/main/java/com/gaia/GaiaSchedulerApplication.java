package com.gaia;

import com.gaia.core.ExecutionResult;
import com.gaia.core.ExecutionStatus;
import com.gaia.core.TestExecutor;
import com.gaia.scheduler.AdaptiveScheduler;
import com.gaia.scheduler.DomSignatures;
import com.gaia.scheduler.SchedulerSummary;
import com.gaia.spring.EnableGaiaScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating the adaptive scheduler.
 * Uses a simulated executor so no remote browser host is required.
 */
@SpringBootApplication
@EnableGaiaScheduler
public class GaiaSchedulerApplication {

    private static final Logger log = LoggerFactory.getLogger(GaiaSchedulerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GaiaSchedulerApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(AdaptiveScheduler scheduler) {
        return args -> {
            log.info("=== GAIA Scheduler Demo Started ===");

            scheduler.ingestItems(List.of(
                    Map.of("id", "login", "priority", "MUST", "new_elements", 2, "target_url", "/login"),
                    Map.of("id", "search", "priority", "SHOULD", "new_elements", 1),
                    Map.of("id", "dashboard", "priority", "MUST", "target_url", "/dashboard"),
                    Map.of("id", "footer-links", "priority", "MAY", "no_dom_change", true),
                    Map.of("id", "profile", "priority", "SHOULD", "target_url", "/profile")
            ));

            log.info("Queued {} items, top pending: {}",
                    scheduler.getQueue().size(), scheduler.getQueue().getTopN(3));

            // Logging in reveals a new page; everything else stays on the landing DOM
            String landing = DomSignatures.compute(Map.of("elements", List.of(
                    Map.of("tag", "a", "selector", "#login"))));
            String loggedIn = DomSignatures.compute(Map.of("elements", List.of(
                    Map.of("tag", "a", "selector", "#logout"),
                    Map.of("tag", "nav", "selector", "#menu"))));

            TestExecutor simulated = item -> {
                Thread.sleep(100);
                String dom = "login".equals(item.getId()) ? loggedIn : landing;
                return ExecutionResult.builder()
                        .status(ExecutionStatus.SUCCESS)
                        .domSignature(dom)
                        .currentUrl(item.getTargetUrl())
                        .build();
            };

            SchedulerSummary summary = scheduler.executeUntilComplete(simulated);

            log.info("=== Run Completed ===");
            log.info("Execution stats: {}", summary.executionStats());
            log.info("State: {}", summary.stateSummary());
            log.info("Remaining in queue: {}", summary.queueSummary().remainingItems());
            log.info("Log summary: {}", summary.logSummary());

            System.exit(0);
        };
    }
}
