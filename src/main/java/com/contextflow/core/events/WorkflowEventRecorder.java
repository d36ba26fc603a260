package com.contextflow.core.events;

import com.contextflow.config.ContextFlowProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Keeps a bounded event timeline per workflow and writes an audit log line for recoveries,
 * phase failures and workflow outcomes.
 * <p>
 * Timelines of finished workflows are retained up to {@code contextflow.events.retained-workflows};
 * the oldest finished timeline is dropped first. Timelines of running workflows are never evicted.
 */
@Service
public class WorkflowEventRecorder {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEventRecorder.class);

    private final int historyLimit;
    private final int retainedWorkflows;
    private final ConcurrentHashMap<String, Deque<WorkflowEvent>> timelines = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> finished = new ConcurrentLinkedQueue<>();
    private final EventBus.Subscription subscription;

    @Autowired
    public WorkflowEventRecorder(EventBus eventBus, ContextFlowProperties properties) {
        this(eventBus, properties.getEvents().getHistoryLimit(), properties.getEvents().getRetainedWorkflows());
    }

    WorkflowEventRecorder(EventBus eventBus, int historyLimit, int retainedWorkflows) {
        this.historyLimit = Math.max(1, historyLimit);
        this.retainedWorkflows = Math.max(0, retainedWorkflows);
        this.subscription = eventBus.subscribe(event -> event.workflowId() != null, this::record);
    }

    /**
     * Events recorded for a workflow (or a task id, for analysis events), oldest first.
     */
    public List<WorkflowEvent> history(String workflowId) {
        Deque<WorkflowEvent> timeline = timelines.get(workflowId);
        if (timeline == null) {
            return List.of();
        }
        synchronized (timeline) {
            return List.copyOf(timeline);
        }
    }

    /** Event counts by type for one workflow, in first-seen order. */
    public Map<String, Integer> countsByType(String workflowId) {
        var counts = new LinkedHashMap<String, Integer>();
        history(workflowId).forEach(e -> counts.merge(e.eventType(), 1, Integer::sum));
        return counts;
    }

    public Set<String> trackedWorkflows() {
        return Set.copyOf(timelines.keySet());
    }

    @PreDestroy
    public void close() {
        subscription.unsubscribe();
    }

    void record(WorkflowEvent event) {
        Deque<WorkflowEvent> timeline = timelines.computeIfAbsent(event.workflowId(), k -> new ArrayDeque<>());
        synchronized (timeline) {
            if (timeline.size() >= historyLimit) {
                timeline.removeFirst();
            }
            timeline.addLast(event);
        }
        audit(event);
        if (event.isOutcome()) {
            finished.add(event.workflowId());
            evictFinished();
        }
    }

    private void audit(WorkflowEvent event) {
        switch (event.eventType()) {
            case WorkflowEvent.PHASE_RECOVERY -> log.warn("Recovery in {} for phase {}: {} ({})",
                    event.workflowId(), event.phaseId(), event.payload().get("action"), event.payload().get("reason"));
            case WorkflowEvent.PHASE_FAILED -> log.warn("Phase {} of {} failed: {}",
                    event.phaseId(), event.workflowId(), event.payload().get("reason"));
            case WorkflowEvent.WORKFLOW_COMPLETED, WorkflowEvent.WORKFLOW_FAILED, WorkflowEvent.WORKFLOW_CANCELLED ->
                    log.info("Workflow {} ended with {} after {} recorded events",
                            event.workflowId(), event.eventType(), history(event.workflowId()).size());
            default -> log.trace("Recorded {} for {}", event.eventType(), event.workflowId());
        }
    }

    private void evictFinished() {
        while (finished.size() > retainedWorkflows) {
            String oldest = finished.poll();
            if (oldest == null) {
                return;
            }
            // a re-executed workflow id may still be listed once more further back
            if (!finished.contains(oldest)) {
                timelines.remove(oldest);
                log.debug("Evicted event timeline of workflow {}", oldest);
            }
        }
    }
}
