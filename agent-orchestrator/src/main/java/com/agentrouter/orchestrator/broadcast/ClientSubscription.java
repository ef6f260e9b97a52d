package com.agentrouter.orchestrator.broadcast;

import com.agentrouter.common.event.EventEnvelope;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One connected tracking client.
 *
 * <p>Events are buffered in a bounded {@link ClientEventQueue} and drained into the outbound
 * {@link Flux} only as fast as the connection requests them. A client receives every session
 * until its first {@code start_log_streaming}; from then on only the sessions it focused on.
 */
public final class ClientSubscription {

    private final String clientId;
    private final ClientEventQueue queue;
    private final Set<String> focusedSessions = ConcurrentHashMap.newKeySet();
    private final AtomicReference<FluxSink<EventEnvelope>> sink = new AtomicReference<>();
    private final AtomicReference<Instant> lastPong;
    private final Object drainLock = new Object();
    private final Flux<EventEnvelope> events;
    private volatile boolean scoped;

    ClientSubscription(String clientId, int capacity, Instant now) {
        this.clientId = clientId;
        this.queue    = new ClientEventQueue(capacity);
        this.lastPong = new AtomicReference<>(now);
        this.events   = Flux.<EventEnvelope>create(s -> {
            sink.set(s);
            s.onRequest(n -> drain());
            s.onDispose(() -> sink.compareAndSet(s, null));
        });
    }

    public String clientId() {
        return clientId;
    }

    /** Outbound stream; meant for a single subscriber (the connection). */
    public Flux<EventEnvelope> events() {
        return events;
    }

    boolean accepts(EventEnvelope event) {
        return !scoped || focusedSessions.contains(event.sessionId());
    }

    void enqueue(EventEnvelope event) {
        queue.offer(event);
        drain();
    }

    void focus(String sessionId) {
        focusedSessions.add(sessionId);
        scoped = true;
    }

    void unfocus(String sessionId) {
        focusedSessions.remove(sessionId);
    }

    public void pong(Instant now) {
        lastPong.set(now);
    }

    public boolean pongOverdue(Instant now, Duration timeout) {
        return lastPong.get().plus(timeout).isBefore(now);
    }

    int pending() {
        return queue.size();
    }

    long dropped() {
        return queue.droppedCount();
    }

    void close() {
        FluxSink<EventEnvelope> s = sink.getAndSet(null);
        if (s != null) {
            s.complete();
        }
    }

    private void drain() {
        synchronized (drainLock) {
            FluxSink<EventEnvelope> s = sink.get();
            if (s == null) {
                return;
            }
            while (s.requestedFromDownstream() > 0) {
                EventEnvelope next = queue.poll();
                if (next == null) {
                    return;
                }
                s.next(next);
            }
        }
    }
}
