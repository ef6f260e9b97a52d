package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse complexity bucket assigned to a query by the query analyzer.
 */
public enum Complexity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Complexity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
