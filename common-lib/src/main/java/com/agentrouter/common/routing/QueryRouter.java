package com.agentrouter.common.routing;

import com.agentrouter.common.analysis.QueryAnalyzer;
import com.agentrouter.common.exception.AgentIndexException;
import com.agentrouter.common.exception.InvalidQueryException;
import com.agentrouter.common.model.AgentProfile;
import com.agentrouter.common.model.AgentScore;
import com.agentrouter.common.model.EscalationDecision;
import com.agentrouter.common.model.QueryAnalysis;
import com.agentrouter.common.model.RoutingDecision;

import java.util.Collection;
import java.util.List;

/**
 * Runs the synchronous routing chain for one query:
 * <pre>
 *   text → QueryAnalyzer → AgentRelevanceScorer → AgentSelector → EscalationDecider
 * </pre>
 * Deterministic for a fixed profile set and text, apart from the displayed confidence.
 */
public final class QueryRouter {

    private final JitterSource jitter;
    private final String defaultAgentId;

    public QueryRouter(JitterSource jitter, String defaultAgentId) {
        this.jitter         = jitter;
        this.defaultAgentId = defaultAgentId;
    }

    /**
     * @throws InvalidQueryException when {@code text} is null, empty or whitespace only
     * @throws AgentIndexException   when there is no profile to route to
     */
    public RoutingDecision route(String text, Collection<AgentProfile> profiles) {
        if (text == null || text.isBlank()) {
            throw new InvalidQueryException("Query text must not be empty");
        }
        if (profiles.isEmpty()) {
            throw new AgentIndexException("No agent profiles available for routing");
        }
        long start = System.nanoTime();

        QueryAnalysis analysis = QueryAnalyzer.analyze(text);
        List<AgentScore> scores = AgentRelevanceScorer.scoreAll(profiles, text, analysis, jitter);
        AgentSelector.Selection selection = AgentSelector.select(scores, defaultAgentId);
        EscalationDecision escalation = EscalationDecider.decide(analysis, selection.recommended().size());

        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        return new RoutingDecision(text, analysis, selection.ranked(), selection.recommended(),
            selection.selectedAgentIds(), selection.fallbackUsed(), escalation, elapsedMs);
    }
}
