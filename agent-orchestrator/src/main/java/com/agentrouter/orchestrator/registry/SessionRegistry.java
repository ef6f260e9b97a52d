package com.agentrouter.orchestrator.registry;

import com.agentrouter.orchestrator.broadcast.SessionEventBroadcaster;
import com.agentrouter.orchestrator.exception.SessionNotFoundException;
import com.agentrouter.orchestrator.session.OrchestrationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of live and recently finished sessions.
 *
 * <p>A settled session stays queryable for {@code routing.session.feedback-window}, then it is
 * evicted together with its replay journal.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, OrchestrationSession> sessions = new ConcurrentHashMap<>();
    private final SessionEventBroadcaster broadcaster;
    private final Duration feedbackWindow;

    public SessionRegistry(SessionEventBroadcaster broadcaster,
                           @Value("${routing.session.feedback-window:10m}") Duration feedbackWindow) {
        this.broadcaster    = broadcaster;
        this.feedbackWindow = feedbackWindow;
    }

    public void register(OrchestrationSession session) {
        sessions.put(session.sessionId(), session);
    }

    /**
     * @throws SessionNotFoundException when the session is unknown or already evicted
     */
    public OrchestrationSession require(String sessionId) {
        OrchestrationSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        return session;
    }

    /** Sessions not yet COMPLETED or FAILED, oldest first. */
    public List<OrchestrationSession> active() {
        return sessions.values().stream()
            .filter(s -> !s.state().isTerminal())
            .sorted(Comparator.comparing(OrchestrationSession::createdAt))
            .toList();
    }

    public List<OrchestrationSession> all() {
        return sessions.values().stream()
            .sorted(Comparator.comparing(OrchestrationSession::createdAt))
            .toList();
    }

    public int size() {
        return sessions.size();
    }

    public void scheduleEviction(OrchestrationSession session) {
        String sessionId = session.sessionId();
        Mono.delay(feedbackWindow)
            .subscribe(
                tick -> evict(sessionId),
                err  -> log.warn("Session eviction timer failed. sessionId={}", sessionId, err)
            );
    }

    void evict(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            broadcaster.forget(sessionId);
            log.info("Session evicted after feedback window. sessionId={} remaining={}",
                     sessionId, sessions.size());
        }
    }
}
