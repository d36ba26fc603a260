package com.contextflow.core.orchestration;

import com.contextflow.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tags a completed phase's results with provenance before they are exposed to a later phase
 * as {@code previous_<phaseId>}.
 */
public class ResultPropagator {

    private static final Logger log = LoggerFactory.getLogger(ResultPropagator.class);

    public static final String SOURCE_PHASE = "_source_phase";
    public static final String TARGET_PHASE = "_target_phase";
    public static final String TRANSFORMATION_TIMESTAMP = "_transformation_timestamp";

    public Map<String, Object> propagate(String fromPhase, String toPhase, Map<String, Object> results) {
        var transformed = new LinkedHashMap<String, Object>();
        if (results != null) {
            transformed.putAll(results);
        }
        transformed.put(SOURCE_PHASE, fromPhase);
        transformed.put(TARGET_PHASE, toPhase);
        transformed.put(TRANSFORMATION_TIMESTAMP, Instant.now().toString());

        ValidationResult validation = validate(toPhase, results, transformed);
        if (!validation.passed()) {
            log.warn("Propagated data {} -> {} failed validation: {}", fromPhase, toPhase, validation.messages());
        }
        return transformed;
    }

    /**
     * Checks that the original bag was non-empty and the propagated bag carries its source tag.
     */
    public ValidationResult validate(String phaseId, Map<String, Object> original, Map<String, Object> propagated) {
        var messages = new ArrayList<String>();
        double score = 1.0;
        if (original == null || original.isEmpty()) {
            messages.add("No data provided for phase " + phaseId);
            score = 0.5;
        }
        if (propagated == null || !propagated.containsKey(SOURCE_PHASE)) {
            messages.add("Missing source phase information");
            score -= 0.1;
        }
        return ValidationResult.of(score, messages, Map.of(
                "phase_id", String.valueOf(phaseId),
                "data_keys", propagated == null ? List.of() : List.copyOf(propagated.keySet())));
    }
}
