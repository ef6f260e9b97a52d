package com.agentrouter.orchestrator.logger;

import com.agentrouter.common.model.AggregatedResult;
import com.agentrouter.common.model.RoutingDecision;
import com.agentrouter.common.trace.SessionLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the session lifecycle inside the orchestration pipeline.
 *
 * <p>Logs each stage of a session without introducing any business logic or modifying
 * pipeline behavior. All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #QUERY_RECEIVED}: query accepted and session id assigned</li>
 *   <li>{@link #ROUTING_DECIDED}: scores ranked, agents selected, escalation decided</li>
 *   <li>{@link #DISPATCHING}: one task started per selected agent</li>
 *   <li>{@link #AGENTS_SETTLED}: every agent reached FINISHED or ERROR</li>
 *   <li>{@link #ESCALATED}: waiting on the human escalation</li>
 *   <li>{@link #AGGREGATED}: final result assembled and published</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads sessionId from Reactor Context):
 * <pre>
 *     .doOnEach(sessionFlowLogger.stage(SessionFlowLogger.AGENTS_SETTLED))
 * </pre>
 */
@Component
public class SessionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(SessionFlowLogger.class);

    public static final String QUERY_RECEIVED  = "QUERY_RECEIVED";
    public static final String ROUTING_DECIDED = "ROUTING_DECIDED";
    public static final String DISPATCHING     = "DISPATCHING";
    public static final String AGENTS_SETTLED  = "AGENTS_SETTLED";
    public static final String ESCALATED       = "ESCALATED";
    public static final String AGGREGATED      = "AGGREGATED";

    /**
     * Returns a {@code doOnEach} consumer that logs the lifecycle stage.
     *
     * <p>Reads sessionId from the Reactor Context embedded in the {@link Signal}, never from
     * MDC. Only fires on {@code onNext} and {@code onComplete} of an empty source.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext() && !signal.isOnComplete()) return;
            String sessionId = SessionLogContext.sessionId(signal.getContextView());
            SessionLogContext.log(sessionId, () ->
                log.info("[SessionFlow] stage={} sessionId={}", stageName, sessionId)
            );
        };
    }

    public void logWithSessionId(String stageName, String sessionId) {
        SessionLogContext.log(sessionId, () ->
            log.info("[SessionFlow] stage={} sessionId={}", stageName, sessionId)
        );
    }

    /**
     * Logs a compact summary of a routing decision: top agent, selected agents, fallback and
     * escalation flags, routing time.
     */
    public void logRouting(RoutingDecision decision, String sessionId) {
        SessionLogContext.log(sessionId, () ->
            log.info("[SessionFlow] stage={} topAgent={} selected={} fallback={} complexity={} "
                     + "sentiment={} escalate={} reasons={} routingMs={} sessionId={}",
                     ROUTING_DECIDED,
                     decision.topAgent() != null ? decision.topAgent().agentId() : "N/A",
                     decision.selectedAgentIds(), decision.fallbackUsed(),
                     decision.analysis().complexity(), decision.analysis().sentiment(),
                     decision.escalation().escalate(), decision.escalation().reasons(),
                     String.format("%.2f", decision.processingTimeMs()), sessionId)
        );
    }

    public void logAggregated(AggregatedResult result) {
        SessionLogContext.log(result.sessionId(), () ->
            log.info("[SessionFlow] stage={} overallState={} outcomes={} failedAgents={} "
                     + "confidence={} humanResponse={} sessionId={}",
                     AGGREGATED, result.overallState(), result.outcomes().size(),
                     result.failedAgentIds(), String.format("%.2f", result.confidence()),
                     result.humanResponse() != null, result.sessionId())
        );
    }
}
