package com.agentrouter.orchestrator.escalation;

import com.agentrouter.common.collaborator.HumanEscalationChannel;
import com.agentrouter.common.model.EscalationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link HumanEscalationChannel} answered through the REST API: each escalation parks a
 * one-shot sink until an operator posts a response for that session.
 */
@Component
public class OperatorEscalationChannel implements HumanEscalationChannel {

    private static final Logger log = LoggerFactory.getLogger(OperatorEscalationChannel.class);

    private final Map<String, Sinks.One<String>> pending = new ConcurrentHashMap<>();

    @Override
    public Mono<String> escalate(EscalationRecord record) {
        String sessionId = record.sessionId();
        return Mono.defer(() -> {
            Sinks.One<String> sink = pending.computeIfAbsent(sessionId, id -> Sinks.one());
            log.info("Escalation awaiting operator. sessionId={} priority={} reasons={}",
                     sessionId, record.priority(), record.reasons());
            return sink.asMono();
        }).doFinally(signal -> pending.remove(sessionId));
    }

    /** @return false when no escalation is waiting for {@code sessionId} */
    public boolean resolve(String sessionId, String response) {
        Sinks.One<String> sink = pending.get(sessionId);
        if (sink == null) {
            return false;
        }
        return sink.tryEmitValue(response).isSuccess();
    }
}
