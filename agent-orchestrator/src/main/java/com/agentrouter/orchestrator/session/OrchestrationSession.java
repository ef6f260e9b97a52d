package com.agentrouter.orchestrator.session;

import com.agentrouter.common.model.AgentOutcome;
import com.agentrouter.common.model.AgentRuntimeState;
import com.agentrouter.common.model.AgentScore;
import com.agentrouter.common.model.AgentStatus;
import com.agentrouter.common.model.AggregatedResult;
import com.agentrouter.common.model.EscalationRecord;
import com.agentrouter.common.model.Query;
import com.agentrouter.common.model.RoutingDecision;
import com.agentrouter.common.model.SessionState;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Live state of one query's multi-agent run.
 *
 * <pre>
 *   CREATED → DISPATCHING → AGGREGATING → [ESCALATED] → COMPLETED | FAILED
 * </pre>
 *
 * <p>Each dispatched agent owns one {@link AgentSlot}. Session-level fields are written by
 * the session pipeline only; the escalation record is replaced wholesale. The final result
 * is published once through a {@link Sinks.One} that late readers can still await.
 */
public class OrchestrationSession {

    static final int MAX_LOG_ENTRIES    = 200;
    static final int MAX_RECENT_OUTPUTS = 5;

    private final String sessionId;
    private final Query query;
    private final RoutingDecision decision;
    private final Map<String, AgentSlot> slots;
    private final Instant createdAt;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CREATED);
    private final AtomicReference<EscalationRecord> escalation = new AtomicReference<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, AgentOutcome> outcomes = new ConcurrentHashMap<>();
    private final Deque<AgentOutcome> recentOutputs = new ArrayDeque<>();
    private final Deque<ExecutionLogEntry> executionLog = new ArrayDeque<>();

    private final Sinks.One<Boolean> cancellation = Sinks.one();
    private final Sinks.One<AggregatedResult> result = Sinks.one();
    private volatile Mono<EscalationRecord> escalationResolution;
    private volatile Instant completedAt;

    public OrchestrationSession(Query query, RoutingDecision decision, Instant createdAt) {
        this.sessionId = query.sessionId();
        this.query     = query;
        this.decision  = decision;
        this.createdAt = createdAt;

        Map<String, String> names = new LinkedHashMap<>();
        for (AgentScore score : decision.scores()) {
            names.put(score.agentId(), score.agentName());
        }
        Map<String, AgentSlot> bySlot = new LinkedHashMap<>();
        for (String agentId : decision.selectedAgentIds()) {
            bySlot.put(agentId, new AgentSlot(agentId, names.getOrDefault(agentId, agentId), createdAt));
        }
        this.slots = Collections.unmodifiableMap(bySlot);
    }

    public String sessionId() {
        return sessionId;
    }

    public Query query() {
        return query;
    }

    public RoutingDecision decision() {
        return decision;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public SessionState state() {
        return state.get();
    }

    public Collection<AgentSlot> slots() {
        return slots.values();
    }

    public int agentCount() {
        return slots.size();
    }

    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    // ── lifecycle ─────────────────────────────────────────────────────────

    /**
     * @throws IllegalStateException when {@code next} is not reachable from the current state
     */
    public void transition(SessionState next) {
        while (true) {
            SessionState current = state.get();
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException(
                    "Session " + sessionId + " cannot move from " + current + " to " + next);
            }
            if (state.compareAndSet(current, next)) {
                return;
            }
        }
    }

    public double overallProgress() {
        return slots.values().stream()
            .mapToDouble(slot -> slot.current().progress())
            .average()
            .orElse(0.0);
    }

    public List<AgentStatus> agentStatuses() {
        return slots.values().stream().map(slot -> slot.current().status()).toList();
    }

    // ── cancellation ──────────────────────────────────────────────────────

    public void cancel() {
        cancellation.tryEmitValue(Boolean.TRUE);
    }

    /** Emits once when the session is ended externally. */
    public Mono<Boolean> cancellation() {
        return cancellation.asMono();
    }

    // ── agent outputs ─────────────────────────────────────────────────────

    public void recordOutcome(AgentOutcome outcome) {
        outcomes.put(outcome.agentId(), outcome);
        synchronized (recentOutputs) {
            recentOutputs.addLast(outcome);
            while (recentOutputs.size() > MAX_RECENT_OUTPUTS) {
                recentOutputs.removeFirst();
            }
        }
    }

    public Optional<AgentOutcome> outcomeOf(String agentId) {
        return Optional.ofNullable(outcomes.get(agentId));
    }

    public void appendLog(String source, String status, String message, Instant now) {
        synchronized (executionLog) {
            executionLog.addLast(new ExecutionLogEntry(now, source, status, message));
            while (executionLog.size() > MAX_LOG_ENTRIES) {
                executionLog.removeFirst();
            }
        }
    }

    public List<ExecutionLogEntry> executionLog() {
        synchronized (executionLog) {
            return List.copyOf(executionLog);
        }
    }

    // ── escalation ────────────────────────────────────────────────────────

    public void attachEscalation(EscalationRecord record, Mono<EscalationRecord> resolution) {
        escalation.set(record);
        escalationResolution = resolution;
    }

    /** Applies {@code change} unless the record is already resolved. */
    public EscalationRecord updateEscalation(UnaryOperator<EscalationRecord> change) {
        return escalation.updateAndGet(current ->
            current == null || current.isResolved() ? current : change.apply(current));
    }

    public Optional<EscalationRecord> escalation() {
        return Optional.ofNullable(escalation.get());
    }

    /** Resolution of the attached escalation; empty when none was opened. */
    public Mono<EscalationRecord> escalationResolution() {
        Mono<EscalationRecord> resolution = escalationResolution;
        return resolution != null ? resolution : Mono.empty();
    }

    // ── result ────────────────────────────────────────────────────────────

    public void complete(AggregatedResult aggregated) {
        completedAt = aggregated.completedAt();
        result.tryEmitValue(aggregated);
    }

    public void abort(Throwable error, Instant now) {
        completedAt = now;
        result.tryEmitError(error);
    }

    public Mono<AggregatedResult> awaitResult() {
        return result.asMono();
    }

    // ── views ─────────────────────────────────────────────────────────────

    public SessionSnapshot snapshot(Instant now) {
        List<AgentRuntimeState> agents = new ArrayList<>();
        List<String> completed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (AgentSlot slot : slots.values()) {
            AgentRuntimeState current = slot.current();
            agents.add(current);
            if (current.status() == AgentStatus.FINISHED) {
                completed.add(current.agentName());
            } else if (current.status() == AgentStatus.ERROR) {
                failed.add(current.agentId());
            }
        }
        List<AgentOutcome> recent;
        synchronized (recentOutputs) {
            recent = List.copyOf(recentOutputs);
        }
        double progress = overallProgress();
        return new SessionSnapshot(sessionId, query.text(), state.get(), progress, agents, completed,
            failed, escalation.get(), createdAt, completedAt, estimateCompletion(progress, now), recent);
    }

    public ActiveSessionSummary summary() {
        return new ActiveSessionSummary(sessionId, state.get(), overallProgress(), slots.size(),
            escalation.get() != null, createdAt);
    }

    private Instant estimateCompletion(double progress, Instant now) {
        if (completedAt != null) {
            return completedAt;
        }
        if (progress <= 0.0) {
            return null;
        }
        long elapsedMs = Duration.between(createdAt, now).toMillis();
        long totalMs = Math.round(elapsedMs * 100.0 / progress);
        return createdAt.plusMillis(totalMs);
    }
}
