package com.agentrouter.client;

import reactor.core.publisher.Flux;

import java.net.URI;

/**
 * One duplex text connection to the tracking endpoint.
 */
public interface TrackingTransport {

    /**
     * Opens a connection, sends every {@code outbound} frame and emits every inbound frame.
     * The returned stream never completes normally: a closed or failed connection is signalled
     * as a {@link com.agentrouter.common.exception.TransportException}. Cancelling closes it.
     */
    Flux<String> connect(URI endpoint, Flux<String> outbound);
}
