package com.agentrouter.client;

import com.agentrouter.common.event.ControlMessage;
import com.agentrouter.common.event.EventEnvelope;
import com.agentrouter.common.event.EventType;
import com.agentrouter.common.exception.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Reconnecting subscriber for session tracking events.
 *
 * <p>Per connection:
 * <pre>
 *   connect → start_log_streaming per tracked session → answer every ping with pong
 *     → drop duplicates by per-agent sequence → emit
 * </pre>
 * A connection silent for longer than the inactivity timeout, closed or failed is reopened per
 * {@link ReconnectPolicy}; the server replays each tracked session's latest events on every
 * (re)connect, so terminal events that happened while disconnected are not lost. When the
 * reconnect budget is exhausted the stream completes and the state becomes
 * {@link ConnectionState#DISCONNECTED}.
 */
public class AgentTrackingClient {

    private static final Logger log = LoggerFactory.getLogger(AgentTrackingClient.class);

    public static final Duration DEFAULT_INACTIVITY_TIMEOUT = Duration.ofSeconds(60);

    private final TrackingTransport transport;
    private final URI endpoint;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration inactivityTimeout;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final SequenceTracker sequenceTracker = new SequenceTracker();
    private final Sinks.Many<ConnectionState> states = Sinks.many().replay().latest();

    public AgentTrackingClient(URI endpoint) {
        this(new WebSocketTrackingTransport(), endpoint, ReconnectPolicy.DEFAULT,
             DEFAULT_INACTIVITY_TIMEOUT, Clock.systemUTC());
    }

    public AgentTrackingClient(TrackingTransport transport, URI endpoint, ReconnectPolicy reconnectPolicy,
                               Duration inactivityTimeout, Clock clock) {
        this.transport         = transport;
        this.endpoint          = endpoint;
        this.reconnectPolicy   = reconnectPolicy;
        this.inactivityTimeout = inactivityTimeout;
        this.clock             = clock;
        this.objectMapper      = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Streams de-duplicated events of {@code sessionIds} (all sessions when empty) until the
     * subscriber cancels or the reconnect budget is exhausted. Pings are consumed here.
     */
    public Flux<EventEnvelope> track(Collection<String> sessionIds) {
        List<String> sessions = List.copyOf(sessionIds);
        return Flux.defer(() -> connectOnce(sessions))
            .retryWhen(reconnectPolicy.toRetry(attempt -> {
                log.warn("Tracking connection lost, reconnecting. endpoint={} attempt={} delayMs={}",
                         endpoint, attempt, reconnectPolicy.delayForAttempt(attempt).toMillis());
                states.tryEmitNext(ConnectionState.RECONNECTING);
            }))
            .onErrorResume(TransportException.class, e -> {
                log.warn("Tracking disconnected. endpoint={} reason={}", endpoint, e.getMessage());
                states.tryEmitNext(ConnectionState.DISCONNECTED);
                return Flux.empty();
            });
    }

    public Flux<EventEnvelope> track(String... sessionIds) {
        return track(List.of(sessionIds));
    }

    public Flux<ConnectionState> connectionStates() {
        return states.asFlux();
    }

    public SequenceTracker sequenceTracker() {
        return sequenceTracker;
    }

    // ── one connection ────────────────────────────────────────────────────

    private Flux<EventEnvelope> connectOnce(List<String> sessions) {
        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        for (String sessionId : sessions) {
            outbound.tryEmitNext(encode(new ControlMessage.StartLogStreaming(sessionId)));
        }
        states.tryEmitNext(ConnectionState.CONNECTING);
        boolean[] connected = {false};

        return transport.connect(endpoint, outbound.asFlux())
            .timeout(inactivityTimeout)
            .onErrorMap(TimeoutException.class,
                e -> new TransportException("No traffic from " + endpoint + " within " + inactivityTimeout, e))
            .doOnNext(frame -> {
                if (!connected[0]) {
                    connected[0] = true;
                    states.tryEmitNext(ConnectionState.CONNECTED);
                }
            })
            .concatMap(frame -> decode(frame))
            .filter(envelope -> {
                if (envelope.type() == EventType.PING) {
                    outbound.tryEmitNext(encode(new ControlMessage.Pong(clock.instant())));
                    return false;
                }
                return true;
            })
            .filter(sequenceTracker::accept);
    }

    private Mono<EventEnvelope> decode(String frame) {
        try {
            return Mono.just(objectMapper.readValue(frame, EventEnvelope.class));
        } catch (JsonProcessingException e) {
            log.warn("Undecodable tracking frame skipped. endpoint={} error={}", endpoint, e.getOriginalMessage());
            return Mono.empty();
        }
    }

    private String encode(ControlMessage message) {
        try {
            return objectMapper.writeValueAsString(message.toEnvelope());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Control message not serializable: " + message.type(), e);
        }
    }
}
