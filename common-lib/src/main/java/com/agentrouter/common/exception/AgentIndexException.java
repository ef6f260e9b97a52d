package com.agentrouter.common.exception;

/**
 * The agent index could not be loaded or holds no usable profile.
 */
public class AgentIndexException extends RoutingException {

    public AgentIndexException(String message) {
        super(message);
    }

    public AgentIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
