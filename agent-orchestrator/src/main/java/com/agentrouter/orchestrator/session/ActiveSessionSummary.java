package com.agentrouter.orchestrator.session;

import com.agentrouter.common.model.SessionState;

import java.time.Instant;

public record ActiveSessionSummary(
    String sessionId,
    SessionState phase,
    double overallProgress,
    int agentCount,
    boolean escalated,
    Instant createdAt
) {}
