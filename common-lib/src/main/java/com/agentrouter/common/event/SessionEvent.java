package com.agentrouter.common.event;

import com.agentrouter.common.model.AgentRuntimeState;
import com.agentrouter.common.model.AggregatedResult;
import com.agentrouter.common.model.SessionState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of session state transitions published to subscribers. Each kind owns its
 * payload and knows how to render itself as an {@link EventEnvelope}.
 */
public sealed interface SessionEvent {

    EventType type();

    String sessionId();

    Instant timestamp();

    long sequence();

    EventEnvelope toEnvelope();

    record SessionStarted(
        String sessionId,
        String query,
        List<String> selectedAgentIds,
        boolean escalationRequired,
        Instant timestamp,
        long sequence
    ) implements SessionEvent {

        @Override
        public EventType type() {
            return EventType.SESSION_STARTED;
        }

        @Override
        public EventEnvelope toEnvelope() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("query", query);
            data.put("selected_agents", List.copyOf(selectedAgentIds));
            data.put("escalation_required", escalationRequired);
            return new EventEnvelope(type(), sessionId, null, null, "started", 0.0,
                null, timestamp, sequence, data);
        }
    }

    record AgentStatusUpdate(String sessionId, AgentRuntimeState state) implements SessionEvent {

        @Override
        public EventType type() {
            return EventType.AGENT_STATUS_UPDATE;
        }

        @Override
        public Instant timestamp() {
            return state.lastUpdated();
        }

        @Override
        public long sequence() {
            return state.sequence();
        }

        @Override
        public EventEnvelope toEnvelope() {
            Map<String, Object> data = state.detail() != null ? Map.of("detail", state.detail()) : null;
            return new EventEnvelope(type(), sessionId, state.agentId(), state.agentName(),
                state.status().wireName(), state.progress(), state.currentTask(),
                state.lastUpdated(), state.sequence(), data);
        }
    }

    record PhaseUpdate(
        String sessionId,
        SessionState phase,
        double overallProgress,
        Instant timestamp,
        long sequence
    ) implements SessionEvent {

        @Override
        public EventType type() {
            return EventType.PHASE_UPDATE;
        }

        @Override
        public EventEnvelope toEnvelope() {
            return new EventEnvelope(type(), sessionId, null, null, phase.name().toLowerCase(),
                overallProgress, null, timestamp, sequence, null);
        }
    }

    record SessionComplete(
        String sessionId,
        AggregatedResult result,
        Instant timestamp,
        long sequence
    ) implements SessionEvent {

        @Override
        public EventType type() {
            return EventType.SESSION_COMPLETE;
        }

        @Override
        public EventEnvelope toEnvelope() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("failed_agents", result.failedAgentIds());
            data.put("confidence", result.confidence());
            data.put("result", result);
            return new EventEnvelope(type(), sessionId, null, null, "completed", 100.0,
                null, timestamp, sequence, data);
        }
    }

    record SessionError(
        String sessionId,
        String message,
        List<String> failedAgentIds,
        Instant timestamp,
        long sequence
    ) implements SessionEvent {

        @Override
        public EventType type() {
            return EventType.SESSION_ERROR;
        }

        @Override
        public EventEnvelope toEnvelope() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("message", message);
            data.put("failed_agents", List.copyOf(failedAgentIds));
            return new EventEnvelope(type(), sessionId, null, null, "failed", null,
                null, timestamp, sequence, data);
        }
    }
}
