package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settled contribution of one agent to the aggregated result. {@code content} is null for
 * agents that ended in {@link AgentStatus#ERROR}; {@code error} is null for finished ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentOutcome(
    @JsonProperty("agentId")    String agentId,
    @JsonProperty("agentName")  String agentName,
    @JsonProperty("status")     AgentStatus status,
    @JsonProperty("content")    String content,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("error")      String error
) {
    public static AgentOutcome finished(String agentId, String agentName, AgentResult result) {
        return new AgentOutcome(agentId, agentName, AgentStatus.FINISHED,
            result.content(), result.confidence(), null);
    }

    public static AgentOutcome failed(String agentId, String agentName, String error) {
        return new AgentOutcome(agentId, agentName, AgentStatus.ERROR, null, null, error);
    }
}
