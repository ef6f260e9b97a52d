package com.agentrouter.orchestrator.controller;

import com.agentrouter.common.event.EventEnvelope;
import com.agentrouter.common.event.EventType;
import com.agentrouter.common.model.AggregatedResult;
import com.agentrouter.orchestrator.broadcast.ClientSubscription;
import com.agentrouter.orchestrator.broadcast.SessionEventBroadcaster;
import com.agentrouter.orchestrator.service.OrchestrationService;
import com.agentrouter.orchestrator.session.ActiveSessionSummary;
import com.agentrouter.orchestrator.session.ExecutionLogEntry;
import com.agentrouter.orchestrator.session.OrchestrationSession;
import com.agentrouter.orchestrator.session.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final OrchestrationService orchestrationService;
    private final SessionEventBroadcaster broadcaster;
    private final Clock clock;

    public SessionController(OrchestrationService orchestrationService,
                             SessionEventBroadcaster broadcaster,
                             Clock clock) {
        this.orchestrationService = orchestrationService;
        this.broadcaster          = broadcaster;
        this.clock                = clock;
    }

    @GetMapping
    public Flux<ActiveSessionSummary> active() {
        return Flux.defer(() -> Flux.fromIterable(orchestrationService.activeSessions()))
            .map(OrchestrationSession::summary);
    }

    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<SessionSnapshot>> snapshot(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> orchestrationService.session(sessionId).snapshot(clock.instant()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{sessionId}/logs")
    public Mono<ResponseEntity<List<ExecutionLogEntry>>> logs(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> orchestrationService.session(sessionId).executionLog())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{sessionId}/result")
    public Mono<ResponseEntity<AggregatedResult>> result(@PathVariable String sessionId) {
        return orchestrationService.awaitResult(sessionId).map(ResponseEntity::ok);
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<SessionSnapshot>> end(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> orchestrationService.endSession(sessionId).snapshot(clock.instant()))
            .map(snapshot -> ResponseEntity.accepted().body(snapshot));
    }

    /**
     * Session-scoped event stream for clients without a duplex connection: the session's latest
     * events first, then live ones, ending after {@code session_complete} or {@code session_error}.
     */
    @GetMapping(value = "/{sessionId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<EventEnvelope>> events(@PathVariable String sessionId) {
        return Flux.defer(() -> {
            orchestrationService.session(sessionId);
            ClientSubscription subscription = broadcaster.subscribe("sse-" + UUID.randomUUID());
            broadcaster.startStreaming(subscription, sessionId);
            log.info("SSE stream client connected. sessionId={} clientId={}", sessionId, subscription.clientId());
            return subscription.events()
                .takeUntil(SessionController::endsSession)
                .doFinally(signal -> broadcaster.unsubscribe(subscription));
        }).map(envelope -> ServerSentEvent.<EventEnvelope>builder()
            .id(String.valueOf(envelope.sequence()))
            .event(envelope.type().wireName())
            .data(envelope)
            .build());
    }

    private static boolean endsSession(EventEnvelope envelope) {
        return envelope.type() == EventType.SESSION_COMPLETE || envelope.type() == EventType.SESSION_ERROR;
    }
}
