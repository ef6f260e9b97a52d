package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Relevance of one agent for one query.
 *
 * <p>{@code score} drives ranking and eligibility; {@code confidence} is display-only and may
 * carry random jitter. {@link #wouldTrigger()} is derived from score and threshold and is
 * never stored on its own.
 */
public record AgentScore(
    @JsonProperty("agentId")               String agentId,
    @JsonProperty("agentName")             String agentName,
    @JsonProperty("score")                 double score,
    @JsonProperty("matchedKeywords")       List<String> matchedKeywords,
    @JsonProperty("matchedExpertise")      List<String> matchedExpertise,
    @JsonProperty("confidence")            double confidence,
    @JsonProperty("confidenceThreshold")   double confidenceThreshold,
    @JsonProperty("historicalSuccessRate") double historicalSuccessRate
) {
    public AgentScore {
        matchedKeywords  = List.copyOf(matchedKeywords);
        matchedExpertise = List.copyOf(matchedExpertise);
    }

    @JsonProperty("wouldTrigger")
    public boolean wouldTrigger() {
        return score > confidenceThreshold * 100.0;
    }
}
