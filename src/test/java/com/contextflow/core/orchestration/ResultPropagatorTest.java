package com.contextflow.core.orchestration;

import com.contextflow.core.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultPropagatorTest {

    private final ResultPropagator propagator = new ResultPropagator();

    @Test
    @DisplayName("Propagated bag keeps the results and adds transformation tags")
    void tagsResults() {
        Map<String, Object> propagated = propagator.propagate("a", "b", Map.of("source_code", "x"));

        assertEquals("x", propagated.get("source_code"));
        assertEquals("a", propagated.get(ResultPropagator.SOURCE_PHASE));
        assertEquals("b", propagated.get(ResultPropagator.TARGET_PHASE));
        assertNotNull(propagated.get(ResultPropagator.TRANSFORMATION_TIMESTAMP));
    }

    @Test
    @DisplayName("Empty source results still propagate but fail validation")
    void emptyResults() {
        Map<String, Object> propagated = propagator.propagate("a", "b", null);
        assertEquals("a", propagated.get(ResultPropagator.SOURCE_PHASE));

        ValidationResult validation = propagator.validate("b", Map.of(), propagated);
        assertFalse(validation.passed());
        assertEquals(0.5, validation.score(), 1e-9);
    }

    @Test
    @DisplayName("Missing source tag lowers the score")
    void missingSourceTag() {
        ValidationResult validation = propagator.validate("b", Map.of("k", 1), Map.of("k", 1));
        assertTrue(validation.passed());
        assertEquals(0.9, validation.score(), 1e-9);
        assertTrue(validation.hasMessageContaining("source phase"));
    }
}
