package com.agentrouter.common.exception;

/**
 * Root of the routing engine's unchecked error taxonomy.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
