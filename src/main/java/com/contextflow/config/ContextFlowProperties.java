package com.contextflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "contextflow")
public class ContextFlowProperties {

    private Analyzer analyzer = new Analyzer();
    private Composer composer = new Composer();
    private Templates templates = new Templates();
    private Orchestrator orchestrator = new Orchestrator();
    private Events events = new Events();

    public Analyzer getAnalyzer() { return analyzer; }
    public void setAnalyzer(Analyzer analyzer) { this.analyzer = analyzer; }
    public Composer getComposer() { return composer; }
    public void setComposer(Composer composer) { this.composer = composer; }
    public Templates getTemplates() { return templates; }
    public void setTemplates(Templates templates) { this.templates = templates; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }

    public static class Analyzer {
        /** Complexity score at which a task becomes MEDIUM. */
        private double mediumThreshold = 1.0;
        /** Complexity score at which a task becomes COMPLEX. */
        private double complexThreshold = 2.0;
        private int maxEntities = 20;

        public double getMediumThreshold() { return mediumThreshold; }
        public void setMediumThreshold(double mediumThreshold) { this.mediumThreshold = mediumThreshold; }
        public double getComplexThreshold() { return complexThreshold; }
        public void setComplexThreshold(double complexThreshold) { this.complexThreshold = complexThreshold; }
        public int getMaxEntities() { return maxEntities; }
        public void setMaxEntities(int maxEntities) { this.maxEntities = maxEntities; }
    }

    public static class Composer {
        private double templateThreshold = 0.6;
        private int defaultRetryCount = 3;
        /** Base timeout overrides in seconds, keyed by context id. */
        private Map<String, Integer> timeoutOverrides = new LinkedHashMap<>();

        public double getTemplateThreshold() { return templateThreshold; }
        public void setTemplateThreshold(double templateThreshold) { this.templateThreshold = templateThreshold; }
        public int getDefaultRetryCount() { return defaultRetryCount; }
        public void setDefaultRetryCount(int defaultRetryCount) { this.defaultRetryCount = defaultRetryCount; }
        public Map<String, Integer> getTimeoutOverrides() { return timeoutOverrides; }
        public void setTimeoutOverrides(Map<String, Integer> timeoutOverrides) { this.timeoutOverrides = timeoutOverrides; }
    }

    public static class Templates {
        private boolean enabled = true;
        /** Directory path or classpath location ("classpath:templates/"). */
        private String location = "classpath:templates/";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    public static class Orchestrator {
        private int maxParallel = 4;
        private long retryBaseDelayMs = 1000;
        private int timeoutMaxRetries = 2;
        private double timeoutBackoff = 1.5;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public long getRetryBaseDelayMs() { return retryBaseDelayMs; }
        public void setRetryBaseDelayMs(long retryBaseDelayMs) { this.retryBaseDelayMs = retryBaseDelayMs; }
        public int getTimeoutMaxRetries() { return timeoutMaxRetries; }
        public void setTimeoutMaxRetries(int timeoutMaxRetries) { this.timeoutMaxRetries = timeoutMaxRetries; }
        public double getTimeoutBackoff() { return timeoutBackoff; }
        public void setTimeoutBackoff(double timeoutBackoff) { this.timeoutBackoff = timeoutBackoff; }
    }

    public static class Events {
        /** Events kept per workflow timeline; older events are dropped first. */
        private int historyLimit = 500;
        /** Finished workflow timelines kept in memory. */
        private int retainedWorkflows = 100;

        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
        public int getRetainedWorkflows() { return retainedWorkflows; }
        public void setRetainedWorkflows(int retainedWorkflows) { this.retainedWorkflows = retainedWorkflows; }
    }
}
