package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of the escalation rule for one query. {@code priority} is the highest priority
 * among the reasons, null when there is nothing to escalate.
 */
public record EscalationDecision(
    @JsonProperty("escalate") boolean escalate,
    @JsonProperty("reasons")  List<EscalationReason> reasons,
    @JsonProperty("priority") EscalationPriority priority
) {
    public EscalationDecision {
        reasons = List.copyOf(reasons);
    }

    public static EscalationDecision none() {
        return new EscalationDecision(false, List.of(), null);
    }
}
