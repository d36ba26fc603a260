package com.contextflow.core.orchestration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects oscillating failure patterns where a phase alternates
 * between two distinct errors across attempts (A-B-A pattern).
 * One instance lives inside each {@link WorkflowState}.
 */
public class OscillationDetector {

    private final ConcurrentHashMap<String, List<String>> errorHistory = new ConcurrentHashMap<>();

    public void recordFailure(String phaseId, String errorMessage) {
        errorHistory.computeIfAbsent(phaseId, k -> new ArrayList<>()).add(String.valueOf(errorMessage));
    }

    public boolean isOscillating(String phaseId) {
        var history = errorHistory.get(phaseId);
        if (history == null || history.size() < 3) {
            return false;
        }
        int last = history.size() - 1;
        String current = history.get(last);
        return current.equals(history.get(last - 2)) && !current.equals(history.get(last - 1));
    }

    public int failureCount(String phaseId) {
        var history = errorHistory.get(phaseId);
        return history != null ? history.size() : 0;
    }
}
