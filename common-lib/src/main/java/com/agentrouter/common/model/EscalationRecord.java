package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Human-in-the-loop request attached to a session.
 *
 * <p>Created {@link EscalationStatus#PENDING}; the session does not finalize until it is
 * {@link EscalationStatus#RESOLVED}, either by an operator response or by the escalation
 * timeout ({@code autoResolved = true}, no human response).
 */
public record EscalationRecord(
    @JsonProperty("sessionId")     String sessionId,
    @JsonProperty("query")         String query,
    @JsonProperty("reasons")       List<EscalationReason> reasons,
    @JsonProperty("priority")      EscalationPriority priority,
    @JsonProperty("triggeredAt")   Instant triggeredAt,
    @JsonProperty("status")        EscalationStatus status,
    @JsonProperty("humanResponse") String humanResponse,
    @JsonProperty("resolvedAt")    Instant resolvedAt,
    @JsonProperty("autoResolved")  boolean autoResolved
) {
    public EscalationRecord {
        reasons = List.copyOf(reasons);
    }

    public static EscalationRecord pending(String sessionId, String query,
                                           List<EscalationReason> reasons,
                                           EscalationPriority priority, Instant now) {
        return new EscalationRecord(sessionId, query, reasons, priority, now,
            EscalationStatus.PENDING, null, null, false);
    }

    public EscalationRecord resolve(String response, Instant now) {
        return new EscalationRecord(sessionId, query, reasons, priority, triggeredAt,
            EscalationStatus.RESOLVED, response, now, false);
    }

    public EscalationRecord autoResolve(Instant now) {
        return new EscalationRecord(sessionId, query, reasons, priority, triggeredAt,
            EscalationStatus.RESOLVED, null, now, true);
    }

    public boolean isResolved() {
        return status == EscalationStatus.RESOLVED;
    }
}
