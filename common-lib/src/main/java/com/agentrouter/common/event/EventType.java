package com.agentrouter.common.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Server-to-client message kinds on the tracking stream.
 */
public enum EventType {
    SESSION_STARTED("session_started"),
    AGENT_STATUS_UPDATE("agent_status_update"),
    PHASE_UPDATE("phase_update"),
    SESSION_COMPLETE("session_complete"),
    SESSION_ERROR("session_error"),
    PING("ping");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventType fromWire(String value) {
        for (EventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
