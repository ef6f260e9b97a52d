package com.agentrouter.orchestrator.session;

import com.agentrouter.common.model.AgentOutcome;
import com.agentrouter.common.model.AgentRuntimeState;
import com.agentrouter.common.model.EscalationRecord;
import com.agentrouter.common.model.SessionState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time tracking view of a session.
 *
 * @param overallProgress     mean progress over the dispatched agents
 * @param estimatedCompletion linear extrapolation of elapsed time over overall progress; null
 *                            until any progress is reported
 * @param recentOutputs       the last five agent outcomes, oldest first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshot(
    String sessionId,
    String query,
    SessionState phase,
    double overallProgress,
    List<AgentRuntimeState> agents,
    List<String> completedAgents,
    List<String> failedAgentIds,
    EscalationRecord escalation,
    Instant createdAt,
    Instant completedAt,
    Instant estimatedCompletion,
    List<AgentOutcome> recentOutputs
) {}
