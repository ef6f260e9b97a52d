package com.agentrouter.common.exception;

/**
 * One agent's execution backend call failed. Always recovered into that agent's
 * ERROR state; never aborts the session.
 */
public class AgentTaskException extends RoutingException {

    public AgentTaskException(String agentId, String message) {
        super("[" + agentId + "] " + message);
    }

    public AgentTaskException(String agentId, String message, Throwable cause) {
        super("[" + agentId + "] " + message, cause);
    }
}
