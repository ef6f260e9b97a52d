package com.agentrouter.orchestrator.controller;

import com.agentrouter.common.model.EscalationReason;
import com.agentrouter.orchestrator.session.OrchestrationSession;

import java.time.Instant;
import java.util.List;

/**
 * Returned on submission; the session keeps running after the response is sent.
 */
public record QueryTicket(
    String sessionId,
    List<String> selectedAgentIds,
    boolean fallbackUsed,
    boolean escalationRequired,
    List<EscalationReason> escalationReasons,
    Instant createdAt
) {
    static QueryTicket of(OrchestrationSession session) {
        return new QueryTicket(session.sessionId(),
            session.decision().selectedAgentIds(),
            session.decision().fallbackUsed(),
            session.decision().escalation().escalate(),
            session.decision().escalation().reasons(),
            session.createdAt());
    }
}
