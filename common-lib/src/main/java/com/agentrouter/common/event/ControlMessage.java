package com.agentrouter.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Optional;

/**
 * Closed set of messages a tracking client may send.
 */
public sealed interface ControlMessage {

    ControlType type();

    Envelope toEnvelope();

    /**
     * Wire shape: {@code {"type": "...", "session_id": "...", "timestamp": ...}}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Envelope(
        @JsonProperty("type")       ControlType type,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("timestamp")  Instant timestamp
    ) {}

    /** Empty when the type is unknown or a required field is missing. */
    static Optional<ControlMessage> from(Envelope envelope) {
        if (envelope == null || envelope.type() == null) {
            return Optional.empty();
        }
        return switch (envelope.type()) {
            case START_LOG_STREAMING -> envelope.sessionId() == null
                ? Optional.empty()
                : Optional.of(new StartLogStreaming(envelope.sessionId()));
            case STOP_LOG_STREAMING -> envelope.sessionId() == null
                ? Optional.empty()
                : Optional.of(new StopLogStreaming(envelope.sessionId()));
            case PONG -> Optional.of(new Pong(envelope.timestamp()));
        };
    }

    /** Focus the connection on one session and replay its latest events. */
    record StartLogStreaming(String sessionId) implements ControlMessage {
        @Override
        public ControlType type() {
            return ControlType.START_LOG_STREAMING;
        }

        @Override
        public Envelope toEnvelope() {
            return new Envelope(type(), sessionId, null);
        }
    }

    record StopLogStreaming(String sessionId) implements ControlMessage {
        @Override
        public ControlType type() {
            return ControlType.STOP_LOG_STREAMING;
        }

        @Override
        public Envelope toEnvelope() {
            return new Envelope(type(), sessionId, null);
        }
    }

    /** Keepalive answer to a server ping. */
    record Pong(Instant timestamp) implements ControlMessage {
        @Override
        public ControlType type() {
            return ControlType.PONG;
        }

        @Override
        public Envelope toEnvelope() {
            return new Envelope(type(), null, timestamp);
        }
    }
}
