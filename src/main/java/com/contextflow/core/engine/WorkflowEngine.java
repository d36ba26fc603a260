package com.contextflow.core.engine;

import com.contextflow.core.analysis.TaskAnalyzer;
import com.contextflow.core.composition.WorkflowComposer;
import com.contextflow.core.events.EventBus;
import com.contextflow.core.events.WorkflowEvent;
import com.contextflow.core.events.WorkflowEventRecorder;
import com.contextflow.core.logging.MdcContext;
import com.contextflow.core.metrics.ContextFlowMetrics;
import com.contextflow.core.model.TaskAnalysis;
import com.contextflow.core.model.WorkflowDefinition;
import com.contextflow.core.model.WorkflowResult;
import com.contextflow.core.orchestration.ContextOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers: analyze a task description, compose a workflow for it and execute
 * that workflow, or do all three with {@link #runTask}.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final TaskAnalyzer analyzer;
    private final WorkflowComposer composer;
    private final ContextOrchestrator orchestrator;
    private final EventBus eventBus;
    private final ContextFlowMetrics metrics;
    private final WorkflowEventRecorder recorder;

    public WorkflowEngine(TaskAnalyzer analyzer, WorkflowComposer composer, ContextOrchestrator orchestrator,
                          EventBus eventBus, @Autowired(required = false) ContextFlowMetrics metrics,
                          @Autowired(required = false) WorkflowEventRecorder recorder) {
        this.analyzer = analyzer;
        this.composer = composer;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.recorder = recorder;
    }

    public TaskAnalysis analyze(String description) {
        return analyze(description, Map.of());
    }

    /**
     * @param hints optional analysis hints such as {@code project_size} or {@code team_experience}
     */
    public TaskAnalysis analyze(String description, Map<String, Object> hints) {
        long start = System.currentTimeMillis();
        TaskAnalysis analysis = analyzer.analyze(description, hints);
        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordAnalysis(analysis.complexity().name(), elapsed);
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("complexity", analysis.complexity().name());
        payload.put("contexts", analysis.requiredContexts());
        payload.put("confidence", analysis.confidence());
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.TASK_ANALYZED, analysis.taskId(), null, payload));
        return analysis;
    }

    public WorkflowDefinition compose(TaskAnalysis analysis) {
        MdcContext.setTask(analysis.taskId());
        try {
            long start = System.currentTimeMillis();
            WorkflowDefinition workflow = composer.compose(analysis);
            long elapsed = System.currentTimeMillis() - start;

            Map<String, Object> meta = workflow.metadata();
            boolean templateUsed = meta.containsKey(WorkflowComposer.META_TEMPLATE_USED);
            Object repairs = meta.get(WorkflowComposer.META_REPAIRS_APPLIED);
            boolean repaired = repairs instanceof List<?> list && !list.isEmpty();
            if (metrics != null) {
                metrics.recordComposition(templateUsed, elapsed);
                if (meta.get(WorkflowComposer.META_VALIDATION_SCORE) instanceof Number score) {
                    metrics.recordValidationScore(score.doubleValue(), repaired);
                }
            }
            var payload = new LinkedHashMap<String, Object>();
            payload.put("taskId", analysis.taskId());
            payload.put("phases", workflow.phases().size());
            payload.put("templateUsed", templateUsed);
            payload.put("validationPassed", meta.getOrDefault(WorkflowComposer.META_VALIDATION_PASSED, false));
            eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_COMPOSED, workflow.workflowId(), null, payload));
            return workflow;
        } finally {
            MdcContext.clear();
        }
    }

    public WorkflowResult execute(WorkflowDefinition workflow) {
        return orchestrator.execute(workflow);
    }

    public WorkflowResult execute(WorkflowDefinition workflow, Map<String, Object> initialContext) {
        return orchestrator.execute(workflow, initialContext);
    }

    public WorkflowResult runTask(String description) {
        return runTask(description, Map.of());
    }

    /**
     * Analyzes, composes and executes in one call. Hints double as the initial context data.
     */
    public WorkflowResult runTask(String description, Map<String, Object> hints) {
        TaskAnalysis analysis = analyze(description, hints);
        WorkflowDefinition workflow = compose(analysis);
        log.info("Running task {} as workflow {}", analysis.taskId(), workflow.workflowId());
        var initialContext = new LinkedHashMap<String, Object>();
        if (hints != null) {
            initialContext.putAll(hints);
        }
        initialContext.put("task_description", analysis.description());
        initialContext.put("task_id", analysis.taskId());
        return orchestrator.execute(workflow, initialContext);
    }

    public boolean cancel(String workflowId) {
        return orchestrator.cancel(workflowId);
    }

    /**
     * Recorded lifecycle events of a workflow, oldest first. Empty when no recorder is configured
     * or the timeline has been evicted.
     */
    public List<WorkflowEvent> history(String workflowId) {
        return recorder == null ? List.of() : recorder.history(workflowId);
    }
}
