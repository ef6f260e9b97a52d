package com.agentrouter.common.exception;

/**
 * Tracking connection lost. Drives reconnect; never fails a session.
 */
public class TransportException extends RoutingException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
