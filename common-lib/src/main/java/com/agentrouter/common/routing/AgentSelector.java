package com.agentrouter.common.routing;

import com.agentrouter.common.model.AgentScore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks agent scores and picks the dispatch set.
 *
 * <p>Ranking: score descending, then historical success rate descending, then agent id
 * ascending, so equal inputs always produce the same order.
 *
 * <p>Recommended: agents that would trigger and score above {@value #MIN_RECOMMENDED_SCORE},
 * at most {@value #MAX_RECOMMENDED}. When none qualify exactly one fallback is selected:
 * the best-ranked agent, or the configured default agent when every score is 0.
 * The selection is never empty for a non-empty score list.
 */
public final class AgentSelector {

    static final int    MAX_RECOMMENDED       = 3;
    static final double MIN_RECOMMENDED_SCORE = 30.0;

    public static final Comparator<AgentScore> RANKING =
        Comparator.comparingDouble(AgentScore::score).reversed()
            .thenComparing(Comparator.comparingDouble(AgentScore::historicalSuccessRate).reversed())
            .thenComparing(AgentScore::agentId);

    private AgentSelector() {}

    public record Selection(
        List<AgentScore> ranked,
        List<AgentScore> recommended,
        List<String> selectedAgentIds,
        boolean fallbackUsed
    ) {}

    /**
     * @param scores         one score per indexed agent
     * @param defaultAgentId agent to fall back to when all scores are 0; may be null
     * @throws IllegalArgumentException when {@code scores} is empty
     */
    public static Selection select(List<AgentScore> scores, String defaultAgentId) {
        if (scores.isEmpty()) {
            throw new IllegalArgumentException("No agent scores to select from");
        }
        List<AgentScore> ranked = scores.stream().sorted(RANKING).toList();

        List<AgentScore> recommended = ranked.stream()
            .filter(s -> s.wouldTrigger() && s.score() > MIN_RECOMMENDED_SCORE)
            .limit(MAX_RECOMMENDED)
            .toList();

        if (!recommended.isEmpty()) {
            return new Selection(ranked, recommended,
                recommended.stream().map(AgentScore::agentId).toList(), false);
        }

        AgentScore fallback = fallback(ranked, defaultAgentId);
        return new Selection(ranked, recommended, List.of(fallback.agentId()), true);
    }

    private static AgentScore fallback(List<AgentScore> ranked, String defaultAgentId) {
        boolean allZero = ranked.stream().allMatch(s -> s.score() == 0.0);
        if (allZero && defaultAgentId != null) {
            Optional<AgentScore> configured = ranked.stream()
                .filter(s -> s.agentId().equals(defaultAgentId))
                .findFirst();
            if (configured.isPresent()) {
                return configured.get();
            }
        }
        return ranked.get(0);
    }
}
