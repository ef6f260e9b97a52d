package com.agentrouter.client;

import com.agentrouter.common.event.EventEnvelope;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * De-duplicates an at-least-once event stream: per stream (agent, or the session itself) only
 * events with a sequence above the last accepted one pass.
 */
public final class SequenceTracker {

    private final Map<String, Long> lastSeen = new ConcurrentHashMap<>();
    private final AtomicLong duplicates = new AtomicLong();

    public boolean accept(EventEnvelope event) {
        boolean[] fresh = {false};
        lastSeen.compute(event.streamKey(), (key, previous) -> {
            if (previous == null || event.sequence() > previous) {
                fresh[0] = true;
                return event.sequence();
            }
            return previous;
        });
        if (!fresh[0]) {
            duplicates.incrementAndGet();
        }
        return fresh[0];
    }

    public long duplicatesDiscarded() {
        return duplicates.get();
    }

    public long lastSequence(String streamKey) {
        return lastSeen.getOrDefault(streamKey, 0L);
    }
}
