package com.agentrouter.orchestrator.broadcast;

import com.agentrouter.common.event.EventEnvelope;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Bounded per-client outbox.
 *
 * <p>Overflow policy when full:
 * <ol>
 *   <li>drop the oldest non-terminal event of the same agent stream as the incoming one;</li>
 *   <li>otherwise drop the oldest non-terminal event of any stream;</li>
 *   <li>otherwise (only terminal events queued) drop the incoming event if it is
 *       non-terminal, or keep it beyond capacity if it is terminal.</li>
 * </ol>
 * Terminal events are never dropped.
 */
final class ClientEventQueue {

    private final int capacity;
    private final Deque<EventEnvelope> events = new ArrayDeque<>();
    private long dropped;

    ClientEventQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    synchronized void offer(EventEnvelope event) {
        if (events.size() >= capacity
                && !dropOldestNonTerminal(event.streamKey())
                && !dropOldestNonTerminal(null)
                && !event.isTerminal()) {
            dropped++;
            return;
        }
        events.addLast(event);
    }

    synchronized EventEnvelope poll() {
        return events.pollFirst();
    }

    synchronized int size() {
        return events.size();
    }

    synchronized long droppedCount() {
        return dropped;
    }

    /** @param streamKey stream to drop from, or null for any stream */
    private boolean dropOldestNonTerminal(String streamKey) {
        Iterator<EventEnvelope> it = events.iterator();
        while (it.hasNext()) {
            EventEnvelope queued = it.next();
            if (!queued.isTerminal() && (streamKey == null || streamKey.equals(queued.streamKey()))) {
                it.remove();
                dropped++;
                return true;
            }
        }
        return false;
    }
}
