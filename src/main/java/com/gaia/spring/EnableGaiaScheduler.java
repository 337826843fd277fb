package com.gaia.spring;

import com.gaia.adapter.spring.GaiaAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Imports {@link GaiaAutoConfiguration}, which registers the loaded {@code GaiaConfig}, an
 * {@code AdaptiveScheduler}, a timeout-bounded remote {@code TestExecutor} and a
 * {@code SchedulerIntegration} tying the two together. Beans the application already defines
 * are kept, and {@code gaia.enabled=false} turns the import into a no-op.
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableGaiaScheduler
 * public class QaAgentApplication {
 *
 *     &#64;Bean
 *     CommandLineRunner run(SchedulerIntegration integration) {
 *         return args -&gt; {
 *             integration.receiveFromAgentJson(Files.readString(Path.of(args[0])));
 *             integration.runAdaptiveExecution();
 *         };
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(GaiaAutoConfiguration.class)
public @interface EnableGaiaScheduler {
}
