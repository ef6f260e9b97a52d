package com.agentrouter.orchestrator.exception;

/**
 * Unknown session id, or a session already evicted after its feedback window.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String message) {
        super(message);
    }
}
