package com.contextflow.core.orchestration;

import com.contextflow.core.model.PhaseStatus;
import com.contextflow.core.model.RecoveryAction;
import com.contextflow.core.model.WorkflowDefinition;
import com.contextflow.core.model.WorkflowPhase;
import com.contextflow.core.model.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable execution state owned by a single {@link ContextOrchestrator#execute} call.
 * <p>
 * Parallel group members write concurrently, each to its own phase id, so all collections are
 * concurrent. Status transitions go through {@code synchronized} methods so that abort and
 * cancellation cannot be overwritten by a later completion.
 */
public class WorkflowState {

    private final String workflowId;
    private final WorkflowDefinition workflow;
    private final Map<String, PhaseStatus> phaseStatus = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> phaseResults = new ConcurrentHashMap<>();
    private final Map<String, Object> contextData = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> contextSnapshots = new ConcurrentHashMap<>();
    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();
    private final List<String> completedPhases = new CopyOnWriteArrayList<>();
    private final List<String> failedPhases = new CopyOnWriteArrayList<>();
    private final List<String> errors = new CopyOnWriteArrayList<>();
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final List<RecoveryAction> recoveryActions = new CopyOnWriteArrayList<>();
    private final OscillationDetector oscillationDetector = new OscillationDetector();

    private volatile WorkflowStatus status = WorkflowStatus.PENDING;
    private volatile String currentContext;
    private volatile String failureReason;
    private volatile Instant startTime;
    private volatile Instant endTime;

    public WorkflowState(WorkflowDefinition workflow, Map<String, Object> initialContext) {
        this.workflowId = workflow.workflowId();
        this.workflow = workflow;
        for (WorkflowPhase phase : workflow.phases()) {
            phaseStatus.put(phase.phaseId(), PhaseStatus.PENDING);
        }
        if (initialContext != null) {
            // ConcurrentHashMap rejects null values
            initialContext.forEach((k, v) -> {
                if (k != null && v != null) {
                    contextData.put(k, v);
                }
            });
        }
    }

    public String workflowId() {
        return workflowId;
    }

    public WorkflowDefinition workflow() {
        return workflow;
    }

    public WorkflowStatus status() {
        return status;
    }

    public synchronized void start() {
        status = WorkflowStatus.RUNNING;
        startTime = Instant.now();
    }

    /** Marks the workflow failed; later completions do not override it. */
    public synchronized void abort(String reason) {
        if (!status.isTerminal()) {
            status = WorkflowStatus.FAILED;
            failureReason = reason;
        }
    }

    /** Returns false when the workflow had already reached a terminal status. */
    public synchronized boolean cancel() {
        if (status.isTerminal()) {
            return false;
        }
        status = WorkflowStatus.CANCELLED;
        failureReason = "cancelled";
        return true;
    }

    /** True once no further phase may start. */
    public boolean isHalted() {
        return status == WorkflowStatus.FAILED || status == WorkflowStatus.CANCELLED;
    }

    /**
     * Completes the workflow: any phase still pending or running is skipped,
     * a running workflow becomes completed, and the end time is set.
     */
    public synchronized void finish() {
        phaseStatus.replaceAll((id, s) -> s.isTerminal() ? s : PhaseStatus.SKIPPED);
        if (status == WorkflowStatus.RUNNING || status == WorkflowStatus.PENDING) {
            status = WorkflowStatus.COMPLETED;
        }
        endTime = Instant.now();
    }

    public void markRunning(String phaseId) {
        phaseStatus.put(phaseId, PhaseStatus.RUNNING);
        attempts.merge(phaseId, 1, Integer::sum);
    }

    public void markCompleted(String phaseId, Map<String, Object> results) {
        phaseResults.put(phaseId, Collections.unmodifiableMap(new LinkedHashMap<>(results)));
        phaseStatus.put(phaseId, PhaseStatus.COMPLETED);
        completedPhases.add(phaseId);
    }

    public void markFailed(String phaseId) {
        phaseStatus.put(phaseId, PhaseStatus.FAILED);
        if (!failedPhases.contains(phaseId)) {
            failedPhases.add(phaseId);
        }
    }

    public void markSkipped(String phaseId) {
        phaseStatus.put(phaseId, PhaseStatus.SKIPPED);
        failedPhases.remove(phaseId);
    }

    public PhaseStatus phaseStatus(String phaseId) {
        return phaseStatus.get(phaseId);
    }

    public Map<String, PhaseStatus> phaseStatuses() {
        var ordered = new LinkedHashMap<String, PhaseStatus>();
        workflow.phases().forEach(p -> ordered.put(p.phaseId(), phaseStatus.get(p.phaseId())));
        return ordered;
    }

    public int attempts(String phaseId) {
        return attempts.getOrDefault(phaseId, 0);
    }

    public Map<String, Map<String, Object>> phaseResults() {
        return phaseResults;
    }

    public Map<String, Object> contextData() {
        return contextData;
    }

    public void putContextData(String key, Object value) {
        if (key != null && value != null) {
            contextData.put(key, value);
        }
    }

    /** Stores a copy of the current context data as the snapshot for the given context. */
    public void snapshotContext(String context) {
        var snapshot = new LinkedHashMap<String, Object>(contextData);
        contextSnapshots.put(context, Collections.unmodifiableMap(snapshot));
    }

    /**
     * Restores context data from the snapshot taken when the given context was last left.
     *
     * @return false when no snapshot exists
     */
    public boolean restoreSnapshot(String context) {
        Map<String, Object> snapshot = contextSnapshots.get(context);
        if (snapshot == null) {
            return false;
        }
        contextData.clear();
        contextData.putAll(snapshot);
        return true;
    }

    public String currentContext() {
        return currentContext;
    }

    public void setCurrentContext(String context) {
        this.currentContext = context;
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        if (!warnings.contains(warning)) {
            warnings.add(warning);
        }
    }

    public void recordRecovery(RecoveryAction action) {
        recoveryActions.add(action);
    }

    public List<String> completedPhases() {
        return List.copyOf(completedPhases);
    }

    public List<String> failedPhases() {
        return List.copyOf(failedPhases);
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    public List<RecoveryAction> recoveryActions() {
        return List.copyOf(recoveryActions);
    }

    public OscillationDetector oscillationDetector() {
        return oscillationDetector;
    }

    public String failureReason() {
        return failureReason;
    }

    public Instant endTime() {
        return endTime;
    }

    public double executionTimeSeconds() {
        if (startTime == null) {
            return 0.0;
        }
        Instant end = endTime != null ? endTime : Instant.now();
        return Duration.between(startTime, end).toMillis() / 1000.0;
    }
}
