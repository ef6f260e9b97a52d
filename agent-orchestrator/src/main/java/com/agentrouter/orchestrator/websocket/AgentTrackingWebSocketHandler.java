package com.agentrouter.orchestrator.websocket;

import com.agentrouter.common.event.ControlMessage;
import com.agentrouter.common.event.EventEnvelope;
import com.agentrouter.common.exception.TransportException;
import com.agentrouter.orchestrator.broadcast.ClientSubscription;
import com.agentrouter.orchestrator.broadcast.SessionEventBroadcaster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Duplex tracking endpoint at {@code /ws/agent-tracking/{clientId}}.
 *
 * <p>Outbound: session events for the client plus a {@code ping} every ping interval. A client
 * that has not answered with {@code pong} within the pong timeout is disconnected so it can
 * reconnect. Inbound control messages: {@code start_log_streaming}, {@code stop_log_streaming},
 * {@code pong}; anything else is logged and ignored.
 */
@Component
public class AgentTrackingWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(AgentTrackingWebSocketHandler.class);

    private final SessionEventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration pingInterval;
    private final Duration pongTimeout;

    public AgentTrackingWebSocketHandler(SessionEventBroadcaster broadcaster,
                                         ObjectMapper objectMapper,
                                         Clock clock,
                                         @Value("${routing.broadcast.ping-interval:30s}") Duration pingInterval,
                                         @Value("${routing.broadcast.pong-timeout:60s}") Duration pongTimeout) {
        this.broadcaster  = broadcaster;
        this.objectMapper = objectMapper;
        this.clock        = clock;
        this.pingInterval = pingInterval;
        this.pongTimeout  = pongTimeout;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String clientId = clientId(session.getHandshakeInfo().getUri());
        ClientSubscription subscription = broadcaster.subscribe(clientId);

        Flux<EventEnvelope> keepalive = Flux.interval(pingInterval)
            .map(tick -> {
                Instant now = clock.instant();
                if (subscription.pongOverdue(now, pongTimeout)) {
                    throw new TransportException("No pong from client " + clientId + " within " + pongTimeout);
                }
                return EventEnvelope.ping(now);
            });

        Mono<Void> output = session.send(
            Flux.merge(subscription.events(), keepalive)
                .map(envelope -> session.textMessage(encode(envelope))));

        Mono<Void> input = session.receive()
            .map(WebSocketMessage::getPayloadAsText)
            .doOnNext(text -> onControl(subscription, text))
            .then();

        return Mono.firstWithSignal(input, output)
            .onErrorResume(TransportException.class, e -> {
                log.warn("Closing tracking connection. clientId={} reason={}", clientId, e.getMessage());
                return session.close(CloseStatus.GOING_AWAY);
            })
            .doFinally(signal -> broadcaster.unsubscribe(subscription));
    }

    // ── control messages ──────────────────────────────────────────────────

    void onControl(ClientSubscription subscription, String text) {
        Optional<ControlMessage> parsed = parse(subscription.clientId(), text);
        if (parsed.isEmpty()) {
            return;
        }
        ControlMessage message = parsed.get();
        switch (message.type()) {
            case START_LOG_STREAMING -> broadcaster.startStreaming(subscription,
                ((ControlMessage.StartLogStreaming) message).sessionId());
            case STOP_LOG_STREAMING -> broadcaster.stopStreaming(subscription,
                ((ControlMessage.StopLogStreaming) message).sessionId());
            case PONG -> subscription.pong(clock.instant());
        }
    }

    private Optional<ControlMessage> parse(String clientId, String text) {
        ControlMessage.Envelope envelope;
        try {
            envelope = objectMapper.readValue(text, ControlMessage.Envelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed control message ignored. clientId={} error={}", clientId, e.getOriginalMessage());
            return Optional.empty();
        }
        Optional<ControlMessage> message = ControlMessage.from(envelope);
        if (message.isEmpty()) {
            log.warn("Unknown control message ignored. clientId={} payload={}", clientId, text);
        }
        return message;
    }

    private String encode(EventEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new TransportException("Could not encode " + envelope.type().wireName() + " event", e);
        }
    }

    static String clientId(URI uri) {
        String path = uri.getPath();
        String last = path.substring(path.lastIndexOf('/') + 1);
        return last.isBlank() ? UUID.randomUUID().toString() : last;
    }
}
