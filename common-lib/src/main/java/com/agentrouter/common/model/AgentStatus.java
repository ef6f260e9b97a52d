package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Per-agent lifecycle inside a session.
 *
 * <pre>
 *   IDLE → ANALYZING → PROCESSING → COLLABORATING → COMPLETING → FINISHED
 *   (any non-terminal) → ERROR
 * </pre>
 * Forward skips are allowed (an agent working alone never collaborates); moving
 * backwards or leaving a terminal status is not.
 */
public enum AgentStatus {
    IDLE,
    ANALYZING,
    PROCESSING,
    COLLABORATING,
    COMPLETING,
    FINISHED,
    ERROR;

    public boolean isTerminal() {
        return this == FINISHED || this == ERROR;
    }

    public boolean canTransitionTo(AgentStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == ERROR) {
            return true;
        }
        return next.ordinal() >= ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
