package com.agentrouter.common.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Client-to-server control message kinds. Unknown wire names map to {@code null}.
 */
public enum ControlType {
    START_LOG_STREAMING("start_log_streaming"),
    STOP_LOG_STREAMING("stop_log_streaming"),
    PONG("pong");

    private final String wireName;

    ControlType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ControlType fromWire(String value) {
        for (ControlType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
