package com.contextflow.core.orchestration;

import com.contextflow.config.ContextFlowProperties;
import com.contextflow.core.context.ContextType;
import com.contextflow.core.events.EventBus;
import com.contextflow.core.events.WorkflowEvent;
import com.contextflow.core.logging.MdcContext;
import com.contextflow.core.metrics.ContextFlowMetrics;
import com.contextflow.core.model.PhaseStatus;
import com.contextflow.core.model.RecoveryAction;
import com.contextflow.core.model.WorkflowDefinition;
import com.contextflow.core.model.WorkflowPhase;
import com.contextflow.core.model.WorkflowResult;
import com.contextflow.core.model.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a {@link WorkflowDefinition} phase by phase across contexts.
 * <p>
 * Each call to {@link #execute} owns a fresh {@link WorkflowState}. Phases run in the fixed
 * order of the {@link ExecutionPlan}; parallel groups fan out onto the phase pool, bounded by
 * {@code contextflow.orchestrator.max-parallel}. Every phase runs under a hard timeout, and
 * failures go through the {@link RecoveryPolicy}. {@code execute} never throws: it always
 * returns a {@link WorkflowResult}, including for total failure.
 */
@Service
public class ContextOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ContextOrchestrator.class);

    private final PhaseExecutorRegistry executors;
    private final RecoveryPolicy recoveryPolicy;
    private final ExecutorService phasePool;
    private final EventBus eventBus;
    private final ContextFlowMetrics metrics;
    private final ContextSwitcher contextSwitcher;
    private final ContextPolicyLoader policyLoader;
    private final ExecutionPlanner planner = new ExecutionPlanner();
    private final ResultPropagator propagator = new ResultPropagator();
    private final int maxParallel;
    private final long retryBaseDelayMs;

    private final ConcurrentHashMap<String, WorkflowState> activeWorkflows = new ConcurrentHashMap<>();

    @Autowired
    public ContextOrchestrator(PhaseExecutorRegistry executors, RecoveryPolicy recoveryPolicy,
                               ExecutorService phasePool, EventBus eventBus, ContextFlowProperties properties,
                               @Autowired(required = false) ContextFlowMetrics metrics,
                               @Autowired(required = false) ContextSwitcher contextSwitcher,
                               @Autowired(required = false) ContextPolicyLoader policyLoader) {
        this(executors, recoveryPolicy, phasePool, eventBus, metrics, contextSwitcher, policyLoader,
                properties.getOrchestrator().getMaxParallel(), properties.getOrchestrator().getRetryBaseDelayMs());
    }

    ContextOrchestrator(PhaseExecutorRegistry executors, RecoveryPolicy recoveryPolicy, ExecutorService phasePool,
                        EventBus eventBus, ContextFlowMetrics metrics, ContextSwitcher contextSwitcher,
                        ContextPolicyLoader policyLoader, int maxParallel, long retryBaseDelayMs) {
        this.executors = executors;
        this.recoveryPolicy = recoveryPolicy;
        this.phasePool = phasePool;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.contextSwitcher = contextSwitcher;
        this.policyLoader = policyLoader;
        this.maxParallel = Math.max(1, maxParallel);
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
    }

    public WorkflowResult execute(WorkflowDefinition workflow) {
        return execute(workflow, Map.of());
    }

    public WorkflowResult execute(WorkflowDefinition workflow, Map<String, Object> initialContext) {
        var state = new WorkflowState(workflow, initialContext);
        String workflowId = workflow.workflowId();
        activeWorkflows.put(workflowId, state);
        MdcContext.setWorkflow(workflowId);

        ExecutionPlan plan = null;
        try {
            state.start();
            log.info("Starting workflow {} ({} phases)", workflowId, workflow.phases().size());
            eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_STARTED, workflowId, null,
                    Map.of("phases", workflow.phases().size(), "name", workflow.name())));

            plan = planner.plan(workflow);
            for (ExecutionPlan.Step step : plan.steps()) {
                if (state.isHalted()) {
                    log.info("Workflow {} halted ({}), remaining steps not started", workflowId, state.status());
                    break;
                }
                if (step.isParallel()) {
                    runParallel(step, state);
                } else {
                    runPhase(step.phases().get(0), state);
                }
            }
        } catch (RuntimeException e) {
            log.error("Workflow {} failed: {}", workflowId, e.getMessage(), e);
            state.addError("Workflow failed: " + e.getMessage());
            state.abort(String.valueOf(e.getMessage()));
        } finally {
            state.finish();
            activeWorkflows.remove(workflowId, state);
        }

        WorkflowResult result = buildResult(state, plan);
        publishOutcome(result, state);
        MdcContext.clear();
        return result;
    }

    /**
     * Requests cancellation of an in-flight workflow. Running phases finish; no further step starts.
     *
     * @return true when the workflow was running and is now cancelled
     */
    public boolean cancel(String workflowId) {
        WorkflowState state = activeWorkflows.get(workflowId);
        if (state == null) {
            log.warn("Cancel requested for unknown or finished workflow {}", workflowId);
            return false;
        }
        boolean cancelled = state.cancel();
        if (cancelled) {
            log.info("Workflow {} cancelled", workflowId);
        }
        return cancelled;
    }

    public Set<String> activeWorkflowIds() {
        return Set.copyOf(activeWorkflows.keySet());
    }

    private void runParallel(ExecutionPlan.Step step, WorkflowState state) {
        log.info("Executing {} phases in parallel ({})", step.phases().size(), step.parallelGroup());
        if (metrics != null) {
            metrics.recordParallelGroup(step.phases().size());
        }
        var semaphore = new Semaphore(maxParallel);
        var futures = new ArrayList<CompletableFuture<Void>>();

        for (WorkflowPhase phase : step.phases()) {
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    semaphore.acquire();
                    try {
                        runPhase(phase, state);
                    } finally {
                        semaphore.release();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    state.addError("Phase " + phase.phaseId() + " interrupted before start");
                    state.markFailed(phase.phaseId());
                } finally {
                    MdcContext.clear();
                }
            }, phasePool));
        }

        for (var future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                log.error("Unexpected error in parallel group {}", step.parallelGroup(), e);
                state.addError("Parallel group " + step.parallelGroup() + " error: " + e.getCause().getMessage());
            }
        }
    }

    /**
     * Runs one phase to a terminal status, applying recovery actions between attempts.
     */
    void runPhase(WorkflowPhase phase, WorkflowState state) {
        MdcContext.setPhase(state.workflowId(), phase.phaseId(), phase.context());
        try {
            while (true) {
                if (state.isHalted()) {
                    return;
                }
                Throwable error = attempt(phase, state);
                if (error == null) {
                    return;
                }

                state.oscillationDetector().recordFailure(phase.phaseId(),
                        error.getClass().getSimpleName() + ": " + error.getMessage());
                RecoveryAction action = recoveryPolicy.evaluate(phase, error, state);
                state.recordRecovery(action);
                if (metrics != null) {
                    metrics.recordRecoveryAction(action.type().name().toLowerCase());
                }
                log.info("Recovery for phase {}: {} ({})", phase.phaseId(), action.type(), action.reason());
                eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_RECOVERY, state.workflowId(), phase.phaseId(),
                        Map.of("action", action.type().name(), "reason", String.valueOf(action.reason()))));

                switch (action.type()) {
                    case RETRY, ROLLBACK -> {
                        int allowed = Math.min(phase.retryCount(), action.maxRetries());
                        int retriesUsed = state.attempts(phase.phaseId()) - 1;
                        if (retriesUsed >= allowed) {
                            log.warn("Phase {} exhausted {} retries", phase.phaseId(), allowed);
                            fail(phase, state, "retries exhausted");
                            return;
                        }
                        if (action.type() == RecoveryAction.Type.ROLLBACK && !state.restoreSnapshot(phase.context())) {
                            log.warn("No snapshot to roll back for context {}", phase.context());
                        }
                        if (!backoff(action, retriesUsed)) {
                            fail(phase, state, "interrupted during backoff");
                            state.abort("Interrupted");
                            return;
                        }
                    }
                    case SKIP -> {
                        state.markSkipped(phase.phaseId());
                        eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_SKIPPED, state.workflowId(), phase.phaseId(),
                                Map.of("context", phase.context(), "reason", String.valueOf(action.reason()))));
                        return;
                    }
                    case ESCALATE -> {
                        state.addWarning("Escalated phase " + phase.phaseId() + ": " + action.reason());
                        fail(phase, state, "escalated");
                        return;
                    }
                    case ABORT -> {
                        fail(phase, state, "aborted");
                        state.abort(action.reason() + ": " + error.getMessage());
                        return;
                    }
                }
            }
        } finally {
            MdcContext.clearPhase();
        }
    }

    /**
     * One execution attempt.
     *
     * @return null on success or skip, otherwise the failure cause
     */
    private Throwable attempt(WorkflowPhase phase, WorkflowState state) {
        String phaseId = phase.phaseId();
        state.markRunning(phaseId);
        int attemptNumber = state.attempts(phaseId);
        log.info("Executing phase {} [{}], attempt {}", phase.name(), phase.context(), attemptNumber);
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_STARTED, state.workflowId(), phaseId,
                Map.of("context", phase.context(), "attempt", attemptNumber)));

        Map<String, Object> inputs = prepareInputs(phase, state);
        if (phase.condition() != null && !phase.condition().test(inputs)) {
            log.info("Phase {} condition not met, skipping", phaseId);
            state.markSkipped(phaseId);
            eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_SKIPPED, state.workflowId(), phaseId,
                    Map.of("context", phase.context(), "reason", "condition not met")));
            return null;
        }

        long startMs = System.currentTimeMillis();
        CompletableFuture<Map<String, Object>> future = null;
        try {
            transition(phase, state);
            PhaseExecutor executor = executors.executorFor(phase.context());
            future = executor.executeAsync(phase, inputs, state, phasePool);
            Map<String, Object> results = future.get(phase.timeoutSeconds(), TimeUnit.SECONDS);
            validateResults(phase, results);

            state.markCompleted(phaseId, results);
            long elapsedMs = System.currentTimeMillis() - startMs;
            recordPhase(phase, "completed", elapsedMs);
            log.info("Phase {} completed in {}ms", phaseId, elapsedMs);
            eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_COMPLETED, state.workflowId(), phaseId,
                    Map.of("context", phase.context(), "durationMs", elapsedMs)));
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Phase timeout: {} exceeded {}s", phase.name(), phase.timeoutSeconds());
            state.addError("Phase timeout: " + phase.name() + " exceeded " + phase.timeoutSeconds() + "s");
            state.addWarning("Consider increasing timeout for phase: " + phase.name());
            if (metrics != null) {
                metrics.recordPhaseTimeout(phase.context());
            }
            recordPhase(phase, "timeout", System.currentTimeMillis() - startMs);
            return e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return attemptFailed(phase, state, cause, startMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return attemptFailed(phase, state,
                    new PhaseExecutionException(phaseId, phase.context(), "Phase interrupted"), startMs);
        } catch (RuntimeException e) {
            return attemptFailed(phase, state, e, startMs);
        }
    }

    private Throwable attemptFailed(WorkflowPhase phase, WorkflowState state, Throwable cause, long startMs) {
        log.error("Phase execution failed: {} ({}): {}", phase.name(), phase.context(), cause.getMessage());
        state.addError("Phase " + phase.phaseId() + " (" + phase.context() + "): " + cause.getMessage());
        recordPhase(phase, "failed", System.currentTimeMillis() - startMs);
        return cause;
    }

    private void fail(WorkflowPhase phase, WorkflowState state, String reason) {
        state.markFailed(phase.phaseId());
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_FAILED, state.workflowId(), phase.phaseId(),
                Map.of("context", phase.context(), "reason", reason, "attempts", state.attempts(phase.phaseId()))));
    }

    private boolean backoff(RecoveryAction action, int retriesUsed) {
        long delay = (long) (retryBaseDelayMs * Math.pow(action.backoff(), retriesUsed));
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Validates the target context, snapshots the context data, notifies the switcher and loads
     * context policy into {@code <context>_rules}.
     */
    void transition(WorkflowPhase phase, WorkflowState state) {
        String to = phase.context();
        if (!ContextType.isKnown(to)) {
            throw new PhaseValidationException(phase.phaseId(), to, List.of("Invalid context transition to " + to));
        }
        String from = state.currentContext();
        if (from != null) {
            state.snapshotContext(from);
        }
        state.snapshotContext(to);
        if (contextSwitcher != null) {
            contextSwitcher.switchContext(from, to, state);
        }
        if (policyLoader != null) {
            Map<String, Object> rules = policyLoader.loadPolicy(to);
            if (rules != null) {
                state.putContextData(to + "_rules", rules);
            }
        }
        state.setCurrentContext(to);
        log.debug("Context transition {} -> {}", from, to);
    }

    /**
     * Context data, then {@code previous_<phaseId>} bags from completed phases, then declared inputs
     * taken from context data or, failing that, from the latest completed phase that produced them.
     */
    Map<String, Object> prepareInputs(WorkflowPhase phase, WorkflowState state) {
        var inputs = new LinkedHashMap<String, Object>(state.contextData());
        List<String> completed = state.completedPhases();
        for (String previous : completed) {
            Map<String, Object> results = state.phaseResults().get(previous);
            inputs.put("previous_" + previous, propagator.propagate(previous, phase.phaseId(), results));
        }
        for (String input : phase.inputs()) {
            if (state.contextData().containsKey(input)) {
                inputs.put(input, state.contextData().get(input));
                continue;
            }
            for (int i = completed.size() - 1; i >= 0; i--) {
                Map<String, Object> results = state.phaseResults().get(completed.get(i));
                if (results != null && results.containsKey(input)) {
                    inputs.put(input, results.get(input));
                    break;
                }
            }
        }
        return inputs;
    }

    static void validateResults(WorkflowPhase phase, Map<String, Object> results) {
        var violations = new ArrayList<String>();
        if (results == null) {
            violations.add("No results returned");
        } else {
            for (String output : phase.outputs()) {
                if (!results.containsKey(output)) {
                    violations.add("Missing expected output: " + output);
                }
            }
            if (results.containsKey("error") || results.containsKey("errors")) {
                violations.add("Phase results contain errors");
            }
        }
        if (!violations.isEmpty()) {
            throw new PhaseValidationException(phase.phaseId(), phase.context(), violations);
        }
    }

    private WorkflowResult buildResult(WorkflowState state, ExecutionPlan plan) {
        WorkflowDefinition workflow = state.workflow();
        int total = workflow.phases().size();
        List<String> completed = state.completedPhases();
        List<String> failed = state.failedPhases();
        long skipped = state.phaseStatuses().values().stream().filter(s -> s == PhaseStatus.SKIPPED).count();
        double successRate = total == 0 ? 0.0 : (double) completed.size() / total;

        var metricsMap = new LinkedHashMap<String, Object>();
        metricsMap.put("total_phases", total);
        metricsMap.put("completed_phases", completed.size());
        metricsMap.put("failed_phases", failed.size());
        metricsMap.put("skipped_phases", (int) skipped);
        metricsMap.put("success_rate", successRate);
        metricsMap.put("recovery_actions", state.recoveryActions().size());
        if (plan != null) {
            metricsMap.put("execution_steps", plan.steps().size());
        }
        if (state.status() != WorkflowStatus.COMPLETED && state.failureReason() != null) {
            metricsMap.put("failure_reason", state.failureReason());
        }

        var results = new LinkedHashMap<String, Map<String, Object>>();
        for (WorkflowPhase phase : workflow.phases()) {
            Map<String, Object> phaseResults = state.phaseResults().get(phase.phaseId());
            if (phaseResults != null) {
                results.put(phase.phaseId(), phaseResults);
            }
        }

        return new WorkflowResult(
                state.workflowId(),
                state.status(),
                results,
                state.executionTimeSeconds(),
                completed,
                failed,
                state.errors(),
                state.warnings(),
                metricsMap,
                qualityScore(state, completed),
                state.endTime());
    }

    /**
     * Mean over completed phases of passed / declared quality gates, where executors report
     * {@code quality_gates_passed}; completed / total when none of them do.
     */
    static Double qualityScore(WorkflowState state, List<String> completed) {
        if (completed.isEmpty()) {
            return null;
        }
        boolean anyReported = false;
        double sum = 0.0;
        for (String phaseId : completed) {
            Map<String, Object> results = state.phaseResults().get(phaseId);
            Object reported = results == null ? null : results.get("quality_gates_passed");
            if (reported == null) {
                sum += 1.0;
                continue;
            }
            anyReported = true;
            int declared = state.workflow().phase(phaseId).map(p -> p.qualityGates().size()).orElse(0);
            int passed = reported instanceof Collection<?> c ? c.size()
                    : reported instanceof Number n ? n.intValue() : 0;
            sum += declared == 0 ? 1.0 : Math.min(1.0, (double) passed / declared);
        }
        if (!anyReported) {
            return (double) completed.size() / state.workflow().phases().size();
        }
        return sum / completed.size();
    }

    private void publishOutcome(WorkflowResult result, WorkflowState state) {
        String eventType = switch (result.status()) {
            case COMPLETED -> WorkflowEvent.WORKFLOW_COMPLETED;
            case CANCELLED -> WorkflowEvent.WORKFLOW_CANCELLED;
            default -> WorkflowEvent.WORKFLOW_FAILED;
        };
        log.info("Workflow {} finished: status={}, executed={}, failed={}, success_rate={}",
                result.workflowId(), result.status(), result.phasesExecuted().size(),
                result.phasesFailed().size(), String.format("%.2f", result.successRate()));
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", result.status().name());
        payload.put("successRate", result.successRate());
        payload.put("executionTimeSeconds", result.executionTimeSeconds());
        if (state.failureReason() != null) {
            payload.put("reason", state.failureReason());
        }
        eventBus.publish(WorkflowEvent.of(eventType, result.workflowId(), null, payload));
        if (metrics != null) {
            metrics.recordWorkflowResult(result.status().name(), result.successRate());
        }
    }

    private void recordPhase(WorkflowPhase phase, String outcome, long elapsedMs) {
        if (metrics != null) {
            metrics.recordPhaseExecution(ContextType.canonical(phase.context()), outcome, elapsedMs);
        }
    }
}
