package com.agentrouter.client;

import com.agentrouter.common.exception.TransportException;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * {@link TrackingTransport} over a Reactor Netty WebSocket.
 */
public class WebSocketTrackingTransport implements TrackingTransport {

    private final WebSocketClient client;

    public WebSocketTrackingTransport() {
        this(new ReactorNettyWebSocketClient());
    }

    public WebSocketTrackingTransport(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public Flux<String> connect(URI endpoint, Flux<String> outbound) {
        return Flux.create(sink -> {
            Disposable connection = client.execute(endpoint, session -> {
                Mono<Void> send = session.send(outbound.map(session::textMessage));
                Mono<Void> receive = session.receive()
                    .map(WebSocketMessage::getPayloadAsText)
                    .doOnNext(sink::next)
                    .then();
                return Mono.firstWithSignal(receive, send);
            }).subscribe(
                done -> { },
                err  -> sink.error(new TransportException("Tracking connection failed: " + err.getMessage(), err)),
                ()   -> sink.error(new TransportException("Tracking connection closed by " + endpoint.getHost()))
            );
            sink.onDispose(connection);
        });
    }
}
