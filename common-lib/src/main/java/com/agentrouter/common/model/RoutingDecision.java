package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything the routing stage decided for one query, before any agent runs.
 *
 * @param analysis         keywords, complexity and sentiment of the query text
 * @param scores           every agent score, ranked best first
 * @param recommended      eligible agents (wouldTrigger and score &gt; 30), at most three
 * @param selectedAgentIds agents to dispatch; never empty
 * @param fallbackUsed     true when no agent was recommended and a single fallback was chosen
 * @param escalation       human-in-the-loop decision
 * @param processingTimeMs wall time spent routing
 */
public record RoutingDecision(
    @JsonProperty("query")            String query,
    @JsonProperty("analysis")         QueryAnalysis analysis,
    @JsonProperty("scores")           List<AgentScore> scores,
    @JsonProperty("recommended")      List<AgentScore> recommended,
    @JsonProperty("selectedAgentIds") List<String> selectedAgentIds,
    @JsonProperty("fallbackUsed")     boolean fallbackUsed,
    @JsonProperty("escalation")       EscalationDecision escalation,
    @JsonProperty("processingTimeMs") double processingTimeMs
) {
    public RoutingDecision {
        scores           = List.copyOf(scores);
        recommended      = List.copyOf(recommended);
        selectedAgentIds = List.copyOf(selectedAgentIds);
        if (selectedAgentIds.isEmpty()) {
            throw new IllegalArgumentException("A routing decision must select at least one agent");
        }
    }

    @JsonProperty("topAgent")
    public AgentScore topAgent() {
        return scores.isEmpty() ? null : scores.get(0);
    }
}
