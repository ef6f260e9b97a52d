package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable snapshot of one agent's progress within a session.
 *
 * <p>Snapshots are produced only by the task that owns the agent's slot; everyone else
 * reads them. {@code sequence} increases by one with every snapshot so subscribers can
 * order and de-duplicate updates per agent.
 *
 * <p>Progress never decreases while a status holds. On a status change the new value is
 * taken as reported, floored at 0.
 */
public record AgentRuntimeState(
    @JsonProperty("agentId")     String agentId,
    @JsonProperty("agentName")   String agentName,
    @JsonProperty("status")      AgentStatus status,
    @JsonProperty("progress")    double progress,
    @JsonProperty("currentTask") String currentTask,
    @JsonProperty("detail")      String detail,
    @JsonProperty("lastUpdated") Instant lastUpdated,
    @JsonProperty("sequence")    long sequence
) {

    public static AgentRuntimeState idle(String agentId, String agentName, Instant now) {
        return new AgentRuntimeState(agentId, agentName, AgentStatus.IDLE, 0.0, null, null, now, 0L);
    }

    /**
     * Returns the next snapshot.
     *
     * @throws IllegalStateException if the status transition is not allowed
     */
    public AgentRuntimeState advance(AgentStatus next, double reportedProgress, String task, Instant now) {
        if (next != status && !status.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Agent " + agentId + " cannot move from " + status + " to " + next);
        }
        if (next == status && status.isTerminal()) {
            throw new IllegalStateException("Agent " + agentId + " already settled as " + status);
        }
        double bounded = Math.max(0.0, Math.min(100.0, reportedProgress));
        double nextProgress = next == status ? Math.max(progress, bounded) : bounded;
        return new AgentRuntimeState(agentId, agentName, next, nextProgress,
            task != null ? task : currentTask, detail, now, sequence + 1);
    }

    public AgentRuntimeState fail(String reason, Instant now) {
        AgentRuntimeState failed = advance(AgentStatus.ERROR, progress, "Failed", now);
        return new AgentRuntimeState(failed.agentId, failed.agentName, failed.status, failed.progress,
            failed.currentTask, reason, failed.lastUpdated, failed.sequence);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
