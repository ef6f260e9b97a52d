package com.agentrouter.common.exception;

import java.time.Duration;

/**
 * No operator answered an escalation within the configured window.
 */
public class EscalationTimeoutException extends RoutingException {

    private final String sessionId;

    public EscalationTimeoutException(String sessionId, Duration timeout) {
        super("No human response for session " + sessionId + " within " + timeout);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
