package com.agentrouter.orchestrator.broadcast;

import com.agentrouter.common.event.EventEnvelope;
import com.agentrouter.common.event.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans session events out to every connected tracking client.
 *
 * <p>Delivery is at-least-once: a client that (re)starts streaming a session first gets the
 * latest event of every agent of that session, terminal ones included, and may therefore see
 * an event twice. Clients de-duplicate on the per-agent {@code sequence}.
 */
@Component
public class SessionEventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SessionEventBroadcaster.class);

    private final Map<String, ClientSubscription> clients = new ConcurrentHashMap<>();
    private final SessionEventJournal journal = new SessionEventJournal();
    private final int queueCapacity;
    private final Clock clock;

    public SessionEventBroadcaster(@Value("${routing.broadcast.client-queue-capacity:256}") int queueCapacity,
                                   Clock clock) {
        this.queueCapacity = queueCapacity;
        this.clock         = clock;
    }

    public void publish(SessionEvent event) {
        EventEnvelope envelope = event.toEnvelope();
        journal.record(envelope);
        for (ClientSubscription client : clients.values()) {
            if (client.accepts(envelope)) {
                client.enqueue(envelope);
            }
        }
    }

    /** Registers {@code clientId}, replacing and closing any previous connection under that id. */
    public ClientSubscription subscribe(String clientId) {
        ClientSubscription subscription = new ClientSubscription(clientId, queueCapacity, clock.instant());
        ClientSubscription previous = clients.put(clientId, subscription);
        if (previous != null) {
            previous.close();
            log.info("Tracking client replaced. clientId={}", clientId);
        }
        log.info("Tracking client connected. clientId={} clients={}", clientId, clients.size());
        return subscription;
    }

    public void unsubscribe(ClientSubscription subscription) {
        if (clients.remove(subscription.clientId(), subscription)) {
            log.info("Tracking client disconnected. clientId={} pending={} dropped={}",
                     subscription.clientId(), subscription.pending(), subscription.dropped());
        }
        subscription.close();
    }

    /** Focuses {@code subscription} on {@code sessionId} and replays that session's latest events. */
    public void startStreaming(ClientSubscription subscription, String sessionId) {
        subscription.focus(sessionId);
        List<EventEnvelope> replay = journal.replay(sessionId);
        replay.forEach(subscription::enqueue);
        log.info("Log streaming started. clientId={} sessionId={} replayed={}",
                 subscription.clientId(), sessionId, replay.size());
    }

    public void stopStreaming(ClientSubscription subscription, String sessionId) {
        subscription.unfocus(sessionId);
        log.info("Log streaming stopped. clientId={} sessionId={}", subscription.clientId(), sessionId);
    }

    public List<EventEnvelope> replay(String sessionId) {
        return journal.replay(sessionId);
    }

    /** Drops the replay journal of an evicted session. */
    public void forget(String sessionId) {
        journal.forget(sessionId);
    }

    int clientCount() {
        return clients.size();
    }
}
