package com.agentrouter.orchestrator.service;

import com.agentrouter.common.event.SessionEvent;
import com.agentrouter.common.model.AgentOutcome;
import com.agentrouter.common.model.AgentRuntimeState;
import com.agentrouter.common.model.AgentStatus;
import com.agentrouter.common.model.AggregatedResult;
import com.agentrouter.common.model.EscalationRecord;
import com.agentrouter.common.model.Query;
import com.agentrouter.common.model.RoutingDecision;
import com.agentrouter.common.model.SessionState;
import com.agentrouter.common.routing.QueryRouter;
import com.agentrouter.common.trace.SessionLogContext;
import com.agentrouter.orchestrator.broadcast.SessionEventBroadcaster;
import com.agentrouter.orchestrator.escalation.EscalationCoordinator;
import com.agentrouter.orchestrator.index.AgentIndex;
import com.agentrouter.orchestrator.logger.SessionFlowLogger;
import com.agentrouter.orchestrator.registry.SessionRegistry;
import com.agentrouter.orchestrator.session.AgentSlot;
import com.agentrouter.orchestrator.session.AgentTaskRunner;
import com.agentrouter.orchestrator.session.OrchestrationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point of the routing-and-tracking engine.
 *
 * <p>{@link #submitQuery} routes synchronously, registers the session and returns at once;
 * the session then runs detached:
 * <pre>
 *   DISPATCHING → one task per agent (flatMap) → join → AGGREGATING
 *     → [ESCALATED → await escalation resolution] → aggregate → COMPLETED | FAILED
 * </pre>
 * Agent tasks never error, so the join always completes. The final state is a pure function
 * of the settled agent statuses: COMPLETED when any agent finished, FAILED when all errored.
 */
@Service
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    static final String HUMAN_AGENT_NAME = "Human Operator";

    private final QueryRouter queryRouter;
    private final AgentIndex agentIndex;
    private final AgentTaskRunner taskRunner;
    private final SessionRegistry registry;
    private final SessionEventBroadcaster broadcaster;
    private final EscalationCoordinator escalationCoordinator;
    private final SessionFlowLogger flowLogger;
    private final Clock clock;

    public OrchestrationService(QueryRouter queryRouter,
                                AgentIndex agentIndex,
                                AgentTaskRunner taskRunner,
                                SessionRegistry registry,
                                SessionEventBroadcaster broadcaster,
                                EscalationCoordinator escalationCoordinator,
                                SessionFlowLogger flowLogger,
                                Clock clock) {
        this.queryRouter           = queryRouter;
        this.agentIndex            = agentIndex;
        this.taskRunner            = taskRunner;
        this.registry              = registry;
        this.broadcaster           = broadcaster;
        this.escalationCoordinator = escalationCoordinator;
        this.flowLogger            = flowLogger;
        this.clock                 = clock;
    }

    /** Routing preview: same decision as {@link #submitQuery} would take, nothing dispatched. */
    public RoutingDecision analyze(String text) {
        return queryRouter.route(text, agentIndex.profiles());
    }

    /**
     * Routes {@code text}, creates its session and starts dispatching in the background.
     *
     * @throws com.agentrouter.common.exception.InvalidQueryException when the text is blank
     * @throws com.agentrouter.common.exception.AgentIndexException   when no agent profile is available
     */
    public OrchestrationSession submitQuery(String text, Map<String, Object> context) {
        RoutingDecision decision = queryRouter.route(text, agentIndex.profiles());

        String sessionId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        OrchestrationSession session = new OrchestrationSession(new Query(text, sessionId, now, context), decision, now);
        registry.register(session);

        flowLogger.logWithSessionId(SessionFlowLogger.QUERY_RECEIVED, sessionId);
        flowLogger.logRouting(decision, sessionId);
        session.appendLog("session", "created", "Routed to " + decision.selectedAgentIds(), now);

        broadcaster.publish(new SessionEvent.SessionStarted(sessionId, text, decision.selectedAgentIds(),
            decision.escalation().escalate(), now, session.nextSequence()));

        if (decision.escalation().escalate()) {
            escalationCoordinator.open(session);
        }

        SessionLogContext.bind(pipeline(session), sessionId)
            .subscribe(
                result -> SessionLogContext.log(sessionId, () ->
                    log.info("Session settled. sessionId={} overallState={} failedAgents={}",
                             sessionId, result.overallState(), result.failedAgentIds())),
                err -> {
                    SessionLogContext.log(sessionId, () ->
                        log.error("Session pipeline failed. sessionId={}", sessionId, err));
                    session.abort(err, clock.instant());
                    registry.scheduleEviction(session);
                }
            );
        return session;
    }

    public OrchestrationSession session(String sessionId) {
        return registry.require(sessionId);
    }

    public List<OrchestrationSession> activeSessions() {
        return registry.active();
    }

    public List<EscalationRecord> pendingEscalations() {
        return registry.all().stream()
            .flatMap(s -> s.escalation().stream())
            .filter(r -> !r.isResolved())
            .toList();
    }

    /** Waits for the session's aggregated result. */
    public Mono<AggregatedResult> awaitResult(String sessionId) {
        return Mono.defer(() -> registry.require(sessionId).awaitResult());
    }

    /**
     * Signals cancellation to every running agent task of the session; each ends in
     * ERROR(cancelled) and a pending escalation is withdrawn.
     */
    public OrchestrationSession endSession(String sessionId) {
        OrchestrationSession session = registry.require(sessionId);
        session.cancel();
        SessionLogContext.log(sessionId, () ->
            log.info("Session end requested. sessionId={} state={}", sessionId, session.state()));
        return session;
    }

    // ── session pipeline ──────────────────────────────────────────────────

    private Mono<AggregatedResult> pipeline(OrchestrationSession session) {
        return Mono.fromRunnable(() -> enterPhase(session, SessionState.DISPATCHING))
            .doOnEach(flowLogger.stage(SessionFlowLogger.DISPATCHING))
            .thenMany(Flux.fromIterable(session.slots())
                .flatMap(slot -> taskRunner.run(session, slot)))
            .then(Mono.fromRunnable(() -> enterPhase(session, SessionState.AGGREGATING)))
            .doOnEach(flowLogger.stage(SessionFlowLogger.AGENTS_SETTLED))
            .then(Mono.defer(() -> session.escalation().isPresent()
                ? awaitEscalation(session).map(record -> aggregate(session, record))
                : Mono.fromCallable(() -> aggregate(session, null))));
    }

    private Mono<EscalationRecord> awaitEscalation(OrchestrationSession session) {
        enterPhase(session, SessionState.ESCALATED);
        flowLogger.logWithSessionId(SessionFlowLogger.ESCALATED, session.sessionId());
        return session.escalationResolution();
    }

    private void enterPhase(OrchestrationSession session, SessionState phase) {
        session.transition(phase);
        Instant now = clock.instant();
        session.appendLog("session", phase.name().toLowerCase(), "Session phase " + phase, now);
        broadcaster.publish(new SessionEvent.PhaseUpdate(session.sessionId(), phase,
            session.overallProgress(), now, session.nextSequence()));
    }

    /**
     * Folds the settled agent outcomes, plus the operator's answer when there is one, into the
     * final result and publishes it.
     */
    private AggregatedResult aggregate(OrchestrationSession session, EscalationRecord escalation) {
        List<AgentOutcome> outcomes = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        double confidenceSum = 0.0;
        int finished = 0;

        for (AgentSlot slot : session.slots()) {
            AgentRuntimeState state = slot.current();
            AgentOutcome outcome = session.outcomeOf(slot.agentId())
                .orElseGet(() -> AgentOutcome.failed(slot.agentId(), slot.agentName(), state.detail()));
            outcomes.add(outcome);
            if (state.status() == AgentStatus.FINISHED) {
                finished++;
                confidenceSum += outcome.confidence() != null ? outcome.confidence() : 0.0;
            } else {
                failed.add(slot.agentId());
            }
        }

        String humanResponse = escalation != null ? escalation.humanResponse() : null;
        if (humanResponse != null) {
            outcomes.add(new AgentOutcome(AggregatedResult.HUMAN_AGENT_ID, HUMAN_AGENT_NAME,
                AgentStatus.FINISHED, humanResponse, null, null));
        }

        SessionState overall = SessionState.settle(session.agentStatuses());
        Instant now = clock.instant();
        AggregatedResult result = new AggregatedResult(session.sessionId(), overall, outcomes, failed,
            humanResponse, finished == 0 ? 0.0 : confidenceSum / finished, now);

        session.transition(overall);
        session.appendLog("session", overall.name().toLowerCase(),
            "Session " + overall + " with " + failed.size() + " failed agent(s)", now);

        if (overall == SessionState.COMPLETED) {
            broadcaster.publish(new SessionEvent.SessionComplete(session.sessionId(), result, now,
                session.nextSequence()));
        } else {
            broadcaster.publish(new SessionEvent.SessionError(session.sessionId(),
                "All dispatched agents failed", failed, now, session.nextSequence()));
        }
        session.complete(result);
        flowLogger.logAggregated(result);
        registry.scheduleEviction(session);
        return result;
    }
}
