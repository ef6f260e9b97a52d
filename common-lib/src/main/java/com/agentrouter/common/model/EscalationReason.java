package com.agentrouter.common.model;

/**
 * Signals that can hand a session to a human operator.
 */
public enum EscalationReason {
    /** Query complexity bucketed as high. */
    COMPLEX_ISSUE(EscalationPriority.HIGH),
    /** Sentiment at or below -1. */
    NEGATIVE_SENTIMENT(EscalationPriority.HIGH),
    /** More than two agents recommended for the same query. */
    BROAD_MATCH(EscalationPriority.MEDIUM);

    private final EscalationPriority priority;

    EscalationReason(EscalationPriority priority) {
        this.priority = priority;
    }

    public EscalationPriority priority() {
        return priority;
    }
}
