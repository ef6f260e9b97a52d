package com.agentrouter.common.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Overall lifecycle of an orchestration session.
 *
 * <pre>
 *   CREATED → DISPATCHING → AGGREGATING → [ESCALATED] → COMPLETED | FAILED
 * </pre>
 */
public enum SessionState {
    CREATED,
    DISPATCHING,
    AGGREGATING,
    ESCALATED,
    COMPLETED,
    FAILED;

    private static final Map<SessionState, Set<SessionState>> TRANSITIONS = Map.of(
        CREATED,     EnumSet.of(DISPATCHING),
        DISPATCHING, EnumSet.of(AGGREGATING),
        AGGREGATING, EnumSet.of(ESCALATED, COMPLETED, FAILED),
        ESCALATED,   EnumSet.of(COMPLETED, FAILED),
        COMPLETED,   EnumSet.noneOf(SessionState.class),
        FAILED,      EnumSet.noneOf(SessionState.class)
    );

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(SessionState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /**
     * Final state as a pure function of the settled agent statuses: COMPLETED when at least
     * one agent finished, FAILED when every agent errored.
     *
     * @throws IllegalStateException when a status is not terminal yet or none are given
     */
    public static SessionState settle(Collection<AgentStatus> statuses) {
        if (statuses.isEmpty()) {
            throw new IllegalStateException("A session cannot settle without dispatched agents");
        }
        boolean anyFinished = false;
        for (AgentStatus status : statuses) {
            if (!status.isTerminal()) {
                throw new IllegalStateException("Agent still running with status " + status);
            }
            anyFinished |= status == AgentStatus.FINISHED;
        }
        return anyFinished ? COMPLETED : FAILED;
    }
}
