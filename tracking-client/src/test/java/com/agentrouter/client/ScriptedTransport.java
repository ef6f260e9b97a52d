package com.agentrouter.client;

import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Plays one scripted inbound stream per connection attempt; the last script repeats.
 * Records every outbound frame across attempts.
 */
final class ScriptedTransport implements TrackingTransport {

    private final List<Flux<String>> scripts;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile int attempts;

    @SafeVarargs
    ScriptedTransport(Flux<String>... scripts) {
        this.scripts = List.of(scripts);
    }

    @Override
    public Flux<String> connect(URI endpoint, Flux<String> outbound) {
        Flux<String> script = scripts.get(Math.min(attempts, scripts.size() - 1));
        attempts++;
        return Flux.defer(() -> {
            outbound.subscribe(sent::add);
            return script;
        });
    }

    int attempts() {
        return attempts;
    }

    List<String> sent() {
        return sent;
    }
}
