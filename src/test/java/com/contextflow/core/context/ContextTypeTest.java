package com.contextflow.core.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextTypeTest {

    @Test
    @DisplayName("fromId resolves ids, legacy keywords and enum names")
    void resolvesAllNameForms() {
        assertEquals(ContextType.VERIFICATION, ContextType.fromId("verification").orElseThrow());
        assertEquals(ContextType.VERIFICATION, ContextType.fromId("@test").orElseThrow());
        assertEquals(ContextType.SECURITY_REVIEW, ContextType.fromId("SECURITY_REVIEW").orElseThrow());
        assertEquals(ContextType.SECURITY_REVIEW, ContextType.fromId(" Security-Review ").orElseThrow());
    }

    @Test
    @DisplayName("Unknown and blank names do not resolve")
    void unknownNames() {
        assertTrue(ContextType.fromId("astrology").isEmpty());
        assertTrue(ContextType.fromId("").isEmpty());
        assertTrue(ContextType.fromId(null).isEmpty());
        assertFalse(ContextType.isKnown("astrology"));
    }

    @Test
    @DisplayName("canonical maps keywords to ids and leaves unknown names alone")
    void canonical() {
        assertEquals("release", ContextType.canonical("@git"));
        assertEquals("implementation", ContextType.canonical("@code"));
        assertEquals("astrology", ContextType.canonical("astrology"));
    }
}
