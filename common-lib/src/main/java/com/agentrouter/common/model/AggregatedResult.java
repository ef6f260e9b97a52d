package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Best-effort answer for a settled session.
 *
 * <p>{@code outcomes} holds one entry per dispatched agent plus, when an operator answered
 * an escalation, a synthetic {@code human} entry. {@code failedAgentIds} lists every agent
 * that ended in {@link AgentStatus#ERROR}. {@code confidence} is the mean confidence of the
 * agents that finished, 0 when none did.
 */
public record AggregatedResult(
    @JsonProperty("sessionId")      String sessionId,
    @JsonProperty("overallState")   SessionState overallState,
    @JsonProperty("outcomes")       List<AgentOutcome> outcomes,
    @JsonProperty("failedAgentIds") List<String> failedAgentIds,
    @JsonProperty("humanResponse")  String humanResponse,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("completedAt")    Instant completedAt
) {
    public static final String HUMAN_AGENT_ID = "human";

    public AggregatedResult {
        outcomes       = List.copyOf(outcomes);
        failedAgentIds = List.copyOf(failedAgentIds);
    }
}
