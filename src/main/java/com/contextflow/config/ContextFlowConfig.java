package com.contextflow.config;

import com.contextflow.core.composition.TemplateLibrary;
import com.contextflow.core.composition.YamlTemplateLibrary;
import com.contextflow.core.context.ContextCatalog;
import com.contextflow.core.orchestration.PhaseExecutor;
import com.contextflow.core.orchestration.PhaseExecutorRegistry;
import com.contextflow.core.orchestration.RecoveryPolicy;
import com.contextflow.core.orchestration.SimulatedPhaseExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ContextFlowConfig {

    private static final Logger log = LoggerFactory.getLogger(ContextFlowConfig.class);

    @Bean
    public ContextCatalog contextCatalog(ContextFlowProperties properties) {
        return ContextCatalog.withTimeoutOverrides(properties.getComposer().getTimeoutOverrides());
    }

    @Bean
    public TemplateLibrary templateLibrary(ContextFlowProperties properties) {
        if (!properties.getTemplates().isEnabled()) {
            log.info("Workflow templates disabled, compositions will be synthesized");
            return TemplateLibrary.empty();
        }
        return new YamlTemplateLibrary(properties.getTemplates().getLocation());
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Pool for phase execution and parallel group members. Unbounded because group members
     * block on phase tasks submitted to the same pool; concurrency is capped by the
     * orchestrator's semaphore instead.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService phaseExecutorPool() {
        var counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "contextflow-phase-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public RecoveryPolicy recoveryPolicy(ContextFlowProperties properties) {
        return RecoveryPolicy.defaults(properties.getOrchestrator());
    }

    @Bean
    public PhaseExecutorRegistry phaseExecutorRegistry(ObjectProvider<PhaseExecutor> executors,
                                                       ContextCatalog catalog) {
        var registry = new PhaseExecutorRegistry(executors.orderedStream().toList(),
                new SimulatedPhaseExecutor(catalog));
        log.info("Phase executor registry ready ({} context executors, simulated fallback)",
                executors.orderedStream().count());
        return registry;
    }
}
