package com.agentrouter.common.routing;

import com.agentrouter.common.model.AgentProfile;
import com.agentrouter.common.model.AgentScore;
import com.agentrouter.common.model.Complexity;
import com.agentrouter.common.model.QueryAnalysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stateless calculator that scores an {@link AgentProfile} against a query.
 *
 * <p><b>Score</b> (clamped to [0, 100]):
 * <pre>
 *   score = 15 × matchedKeywords
 *         + categoryBoost            (10 when the query holds a cue term for the agent's category)
 *         + 8 × matchedExpertise     (first word of an expertise entry found in the query)
 *         + (historicalSuccessRate − 80) / 4
 *         + complexityBonus          (5 when complexity is HIGH and threshold &gt; 0.7)
 * </pre>
 *
 * <p><b>Confidence</b> = min(95, score + jitter). The jitter only affects this displayed
 * value; {@link AgentScore#wouldTrigger()} and ranking use {@code score} alone.
 *
 * <p>Matching is case-insensitive substring containment on the raw query text.
 */
public final class AgentRelevanceScorer {

    static final double KEYWORD_POINTS       = 15.0;
    static final double CATEGORY_BOOST       = 10.0;
    static final double EXPERTISE_POINTS     = 8.0;
    static final double SUCCESS_BASELINE     = 80.0;
    static final double SUCCESS_DIVISOR      = 4.0;
    static final double COMPLEXITY_BONUS     = 5.0;
    static final double BONUS_MIN_THRESHOLD  = 0.7;
    static final double MAX_CONFIDENCE       = 95.0;

    /** Domain cue terms per agent category (category compared case-insensitively). */
    static final Map<String, List<String>> CATEGORY_CUES = Map.of(
        "technical", List.of("api", "integration"),
        "security",  List.of("security", "vulnerability")
    );

    private AgentRelevanceScorer() {}

    public static List<AgentScore> scoreAll(Collection<AgentProfile> profiles, String text,
                                            QueryAnalysis analysis, JitterSource jitter) {
        List<AgentScore> scores = new ArrayList<>(profiles.size());
        for (AgentProfile profile : profiles) {
            scores.add(score(profile, text, analysis, jitter));
        }
        return scores;
    }

    public static AgentScore score(AgentProfile profile, String text,
                                   QueryAnalysis analysis, JitterSource jitter) {
        String lower = text.toLowerCase(Locale.ROOT);

        // ── keywords ──────────────────────────────────────────────────────
        List<String> matchedKeywords = new ArrayList<>();
        for (String keyword : profile.keywords()) {
            if (lower.contains(keyword) && !matchedKeywords.contains(keyword)) {
                matchedKeywords.add(keyword);
            }
        }

        // ── expertise (leading word of each entry) ────────────────────────
        List<String> matchedExpertise = new ArrayList<>();
        for (String skill : profile.expertise()) {
            String lead = skill.toLowerCase(Locale.ROOT).split("\\s+")[0];
            if (!lead.isEmpty() && lower.contains(lead)) {
                matchedExpertise.add(skill);
            }
        }

        double raw = matchedKeywords.size() * KEYWORD_POINTS
                   + categoryBoost(profile.category(), lower)
                   + matchedExpertise.size() * EXPERTISE_POINTS
                   + (profile.historicalSuccessRate() - SUCCESS_BASELINE) / SUCCESS_DIVISOR
                   + complexityBonus(analysis.complexity(), profile.confidenceThreshold());
        double score = clamp(raw);
        double confidence = Math.min(MAX_CONFIDENCE, score + jitter.next());

        return new AgentScore(profile.id(), profile.name(), score, matchedKeywords, matchedExpertise,
            confidence, profile.confidenceThreshold(), profile.historicalSuccessRate());
    }

    private static double categoryBoost(String category, String lowerText) {
        List<String> cues = CATEGORY_CUES.get(category.toLowerCase(Locale.ROOT));
        if (cues == null) {
            return 0.0;
        }
        return cues.stream().anyMatch(lowerText::contains) ? CATEGORY_BOOST : 0.0;
    }

    private static double complexityBonus(Complexity complexity, double threshold) {
        return complexity == Complexity.HIGH && threshold > BONUS_MIN_THRESHOLD ? COMPLEXITY_BONUS : 0.0;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
