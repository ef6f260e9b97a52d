package com.agentrouter.orchestrator.broadcast;

import com.agentrouter.common.event.EventEnvelope;
import com.agentrouter.common.event.EventType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest event per agent (and per session-level event kind) of every live session, kept for
 * replay to clients that (re)start streaming a session.
 */
final class SessionEventJournal {

    /** Session completion or failure always replays last. */
    private static final Comparator<EventEnvelope> REPLAY_ORDER =
        Comparator.<EventEnvelope, Boolean>comparing(SessionEventJournal::endsSession)
            .thenComparing(EventEnvelope::timestamp)
            .thenComparingLong(EventEnvelope::sequence);

    private final Map<String, Map<String, EventEnvelope>> latest = new ConcurrentHashMap<>();

    void record(EventEnvelope event) {
        String slot = event.agentId() != null ? "agent:" + event.agentId() : "session:" + event.type().wireName();
        latest.computeIfAbsent(event.sessionId(), id -> new ConcurrentHashMap<>())
            .merge(slot, event, (previous, incoming) ->
                incoming.sequence() >= previous.sequence() ? incoming : previous);
    }

    List<EventEnvelope> replay(String sessionId) {
        Map<String, EventEnvelope> events = latest.get(sessionId);
        if (events == null) {
            return List.of();
        }
        List<EventEnvelope> ordered = new ArrayList<>(events.values());
        ordered.sort(REPLAY_ORDER);
        return ordered;
    }

    void forget(String sessionId) {
        latest.remove(sessionId);
    }

    private static boolean endsSession(EventEnvelope event) {
        return event.type() == EventType.SESSION_COMPLETE || event.type() == EventType.SESSION_ERROR;
    }
}
