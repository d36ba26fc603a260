package com.contextflow.core.orchestration;

import com.contextflow.core.context.ContextType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up the {@link PhaseExecutor} for a context id. Contexts without a registered
 * executor fall back to the default executor.
 */
public class PhaseExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutorRegistry.class);

    private final Map<String, PhaseExecutor> executors = new ConcurrentHashMap<>();
    private final PhaseExecutor fallback;

    public PhaseExecutorRegistry(PhaseExecutor fallback) {
        this(List.of(), fallback);
    }

    public PhaseExecutorRegistry(Collection<? extends PhaseExecutor> executors, PhaseExecutor fallback) {
        this.fallback = fallback;
        executors.forEach(this::register);
    }

    /** Registers an executor under its context's canonical id, replacing any previous one. */
    public void register(PhaseExecutor executor) {
        String key = ContextType.canonical(executor.context());
        PhaseExecutor previous = executors.put(key, executor);
        if (previous != null && previous != executor) {
            log.info("Replaced phase executor for context {}: {} -> {}", key,
                    previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
        }
    }

    public PhaseExecutor executorFor(String context) {
        return executors.getOrDefault(ContextType.canonical(context), fallback);
    }

    public boolean hasExecutor(String context) {
        return executors.containsKey(ContextType.canonical(context));
    }
}
