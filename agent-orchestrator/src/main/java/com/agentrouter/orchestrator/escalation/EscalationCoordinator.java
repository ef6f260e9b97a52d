package com.agentrouter.orchestrator.escalation;

import com.agentrouter.common.collaborator.HumanEscalationChannel;
import com.agentrouter.common.exception.EscalationTimeoutException;
import com.agentrouter.common.model.EscalationDecision;
import com.agentrouter.common.model.EscalationRecord;
import com.agentrouter.common.trace.SessionLogContext;
import com.agentrouter.orchestrator.session.OrchestrationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Opens the human escalation of a session and owns its resolution policy.
 *
 * <p>The escalation is handed to the {@link HumanEscalationChannel} as soon as the session is
 * created, so operators can work while agents run. It resolves in exactly one of three ways:
 * <ul>
 *   <li>operator response → RESOLVED with that response</li>
 *   <li>no response within {@code routing.escalation.timeout} → auto-resolved, no response</li>
 *   <li>session ended or channel failure → auto-resolved, no response</li>
 * </ul>
 * There is no retry.
 */
@Component
public class EscalationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(EscalationCoordinator.class);

    private final HumanEscalationChannel channel;
    private final OperatorNotifier notifier;
    private final Clock clock;
    private final Duration timeout;

    public EscalationCoordinator(HumanEscalationChannel channel,
                                 OperatorNotifier notifier,
                                 Clock clock,
                                 @Value("${routing.escalation.timeout:5m}") Duration timeout) {
        this.channel  = channel;
        this.notifier = notifier;
        this.clock    = clock;
        this.timeout  = timeout;
    }

    public EscalationRecord open(OrchestrationSession session) {
        EscalationDecision decision = session.decision().escalation();
        String sessionId = session.sessionId();
        EscalationRecord record = EscalationRecord.pending(sessionId, session.query().text(),
            decision.reasons(), decision.priority(), clock.instant());

        Mono<EscalationRecord> resolution = channel.escalate(record)
            .takeUntilOther(session.cancellation())
            .map(response -> session.updateEscalation(r -> r.resolve(response, clock.instant())))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                SessionLogContext.log(sessionId, () ->
                    log.info("Escalation withdrawn with session. sessionId={}", sessionId));
                return autoResolve(session);
            }))
            .timeout(timeout)
            .onErrorResume(TimeoutException.class, e -> Mono.fromSupplier(() -> {
                EscalationTimeoutException timeoutError = new EscalationTimeoutException(sessionId, timeout);
                SessionLogContext.log(sessionId, () ->
                    log.warn("Escalation auto-resolved. sessionId={} reason={}",
                             sessionId, timeoutError.getMessage()));
                return autoResolve(session);
            }))
            .onErrorResume(e -> Mono.fromSupplier(() -> {
                SessionLogContext.log(sessionId, () ->
                    log.warn("Escalation channel failed, auto-resolving. sessionId={}", sessionId, e));
                return autoResolve(session);
            }))
            .cache();

        session.attachEscalation(record, resolution);
        notifier.notifyOperators(record);
        resolution.subscribe(
            r   -> SessionLogContext.log(sessionId, () ->
                       log.info("Escalation resolved. sessionId={} autoResolved={} priority={}",
                                sessionId, r.autoResolved(), r.priority())),
            err -> log.error("Escalation resolution failed. sessionId={}", sessionId, err)
        );
        SessionLogContext.log(sessionId, () ->
            log.info("Escalation opened. sessionId={} priority={} reasons={} timeout={}",
                     sessionId, record.priority(), record.reasons(), timeout));
        return record;
    }

    private EscalationRecord autoResolve(OrchestrationSession session) {
        return session.updateEscalation(r -> r.autoResolve(clock.instant()));
    }
}
