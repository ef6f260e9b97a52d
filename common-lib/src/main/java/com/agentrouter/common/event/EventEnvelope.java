package com.agentrouter.common.event;

import com.agentrouter.common.model.AgentStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Wire shape of every server-to-client tracking message.
 *
 * <p>{@code sequence} is monotonic per agent within a session (per session for session-level
 * events, which carry no agent id). Delivery is at-least-once: consumers de-duplicate on
 * {@link #streamKey()} + {@code sequence}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope(
    @JsonProperty("type")         EventType type,
    @JsonProperty("session_id")   String sessionId,
    @JsonProperty("agent_id")     String agentId,
    @JsonProperty("agent_name")   String agentName,
    @JsonProperty("status")       String status,
    @JsonProperty("progress")     Double progress,
    @JsonProperty("current_task") String currentTask,
    @JsonProperty("timestamp")    Instant timestamp,
    @JsonProperty("sequence")     long sequence,
    @JsonProperty("data")         Map<String, Object> data
) {

    public static EventEnvelope ping(Instant now) {
        return new EventEnvelope(EventType.PING, null, null, null, null, null, null, now, 0L, null);
    }

    /**
     * Terminal events are never dropped by a client queue: an agent reaching FINISHED or
     * ERROR, and the session's own completion or failure.
     */
    @JsonIgnore
    public boolean isTerminal() {
        return switch (type) {
            case AGENT_STATUS_UPDATE -> AgentStatus.FINISHED.wireName().equals(status)
                                     || AgentStatus.ERROR.wireName().equals(status);
            case SESSION_COMPLETE, SESSION_ERROR -> true;
            case SESSION_STARTED, PHASE_UPDATE, PING -> false;
        };
    }

    /** Ordering and de-duplication stream: one per agent, one for the session itself. */
    @JsonIgnore
    public String streamKey() {
        return sessionId + "/" + (agentId != null ? agentId : "");
    }
}
