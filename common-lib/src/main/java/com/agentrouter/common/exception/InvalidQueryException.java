package com.agentrouter.common.exception;

/**
 * Query rejected before scoring. Not retried.
 */
public class InvalidQueryException extends RoutingException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
