package com.agentrouter.orchestrator.session;

import com.agentrouter.common.collaborator.ExecutionBackend;
import com.agentrouter.common.event.SessionEvent;
import com.agentrouter.common.exception.AgentTaskException;
import com.agentrouter.common.model.AgentOutcome;
import com.agentrouter.common.model.AgentResult;
import com.agentrouter.common.model.AgentRuntimeState;
import com.agentrouter.common.model.AgentStatus;
import com.agentrouter.common.trace.SessionLogContext;
import com.agentrouter.orchestrator.broadcast.SessionEventBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs one dispatched agent from IDLE to a terminal status.
 *
 * <pre>
 *   ANALYZING 10 → PROCESSING 25 → [execution backend] → COLLABORATING 70 (multi-agent only)
 *     → COMPLETING 90 → FINISHED 100
 * </pre>
 *
 * <p>Every failure (backend error, empty reply, timeout) and an external cancellation end in
 * {@link AgentStatus#ERROR}; the returned {@link Mono} always emits the terminal state and
 * never errors, so siblings and the session join are unaffected.
 */
@Component
public class AgentTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentTaskRunner.class);

    static final String CANCELLED = "cancelled";

    private final ExecutionBackend executionBackend;
    private final SessionEventBroadcaster broadcaster;
    private final Clock clock;
    private final Duration executionTimeout;

    public AgentTaskRunner(ExecutionBackend executionBackend,
                           SessionEventBroadcaster broadcaster,
                           Clock clock,
                           @Value("${services.execution-backend.timeout:60s}") Duration executionTimeout) {
        this.executionBackend = executionBackend;
        this.broadcaster      = broadcaster;
        this.clock            = clock;
        this.executionTimeout = executionTimeout;
    }

    public Mono<AgentRuntimeState> run(OrchestrationSession session, AgentSlot slot) {
        String agentId = slot.agentId();
        boolean collaborative = session.agentCount() > 1;

        Mono<AgentRuntimeState> work = Mono.fromRunnable(() ->
                step(session, slot, AgentStatus.ANALYZING, 10, "Analyzing query"))
            .then(Mono.fromRunnable(() ->
                step(session, slot, AgentStatus.PROCESSING, 25, "Executing specialist task")))
            .then(Mono.defer(() -> executionBackend.execute(agentId, session.query(), session.sessionId())))
            .switchIfEmpty(Mono.error(() -> new AgentTaskException(agentId, "Execution backend returned no result")))
            .timeout(executionTimeout)
            .map(result -> {
                if (collaborative) {
                    step(session, slot, AgentStatus.COLLABORATING, 70, "Sharing findings");
                }
                step(session, slot, AgentStatus.COMPLETING, 90, "Finalizing response");
                return finish(session, slot, result);
            })
            .onErrorResume(err -> Mono.fromSupplier(() -> failure(session, slot, describe(agentId, err))));

        return work
            .takeUntilOther(session.cancellation())
            .switchIfEmpty(Mono.fromSupplier(() -> failure(session, slot, CANCELLED)));
    }

    // ── state steps ───────────────────────────────────────────────────────

    private void step(OrchestrationSession session, AgentSlot slot, AgentStatus status,
                      double progress, String task) {
        slot.advance(status, progress, task, clock.instant())
            .ifPresent(state -> publish(session, state, task));
    }

    private AgentRuntimeState finish(OrchestrationSession session, AgentSlot slot, AgentResult result) {
        Optional<AgentRuntimeState> finished = slot.advance(AgentStatus.FINISHED, 100, "Completed", clock.instant());
        finished.ifPresent(state -> {
            session.recordOutcome(AgentOutcome.finished(slot.agentId(), slot.agentName(), result));
            publish(session, state, "Completed");
        });
        return slot.current();
    }

    private AgentRuntimeState failure(OrchestrationSession session, AgentSlot slot, String reason) {
        Optional<AgentRuntimeState> failed = slot.fail(reason, clock.instant());
        failed.ifPresent(state -> {
            session.recordOutcome(AgentOutcome.failed(slot.agentId(), slot.agentName(), reason));
            publish(session, state, "Failed: " + reason);
            SessionLogContext.log(session.sessionId(), slot.agentId(), () ->
                log.warn("Agent task ended in ERROR. sessionId={} agentId={} reason={}",
                         session.sessionId(), slot.agentId(), reason));
        });
        return slot.current();
    }

    private void publish(OrchestrationSession session, AgentRuntimeState state, String message) {
        session.appendLog(state.agentName(), state.status().wireName(), message, state.lastUpdated());
        broadcaster.publish(new SessionEvent.AgentStatusUpdate(session.sessionId(), state));
    }

    private String describe(String agentId, Throwable err) {
        if (err instanceof TimeoutException) {
            return "Execution timed out after " + executionTimeout;
        }
        if (err instanceof AgentTaskException) {
            return err.getMessage();
        }
        return new AgentTaskException(agentId, String.valueOf(err.getMessage())).getMessage();
    }
}
