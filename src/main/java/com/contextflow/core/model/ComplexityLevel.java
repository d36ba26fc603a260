package com.contextflow.core.model;

/**
 * Coarse complexity classification assigned to a task during analysis.
 */
public enum ComplexityLevel {
    SIMPLE,
    MEDIUM,
    COMPLEX
}
