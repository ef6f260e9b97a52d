package com.agentrouter.orchestrator.session;

import java.time.Instant;

/**
 * One line of a session's activity log: agent steps and phase changes.
 */
public record ExecutionLogEntry(Instant timestamp, String source, String status, String message) {}
