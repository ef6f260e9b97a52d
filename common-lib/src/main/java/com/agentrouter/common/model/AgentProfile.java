package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable description of one specialist agent as held by the agent index.
 *
 * <p>The field set is closed: every component is required and validated on construction,
 * so a malformed profile is rejected when the index loads it rather than when a query is
 * scored against it. Keywords are normalised to lower case.
 *
 * <ul>
 *   <li>{@code confidenceThreshold} – eligibility cutoff in [0.0, 1.0]; an agent
 *       "would trigger" when its score exceeds {@code confidenceThreshold × 100}.</li>
 *   <li>{@code historicalSuccessRate} – observed success percentage in [0, 100].</li>
 * </ul>
 */
public record AgentProfile(
    @JsonProperty("id")                    String id,
    @JsonProperty("name")                  String name,
    @JsonProperty("category")              String category,
    @JsonProperty("keywords")              List<String> keywords,
    @JsonProperty("expertise")             List<String> expertise,
    @JsonProperty("confidenceThreshold")   double confidenceThreshold,
    @JsonProperty("historicalSuccessRate") double historicalSuccessRate
) {

    public AgentProfile {
        requireText(id, "id");
        requireText(name, "name");
        requireText(category, "category");
        Objects.requireNonNull(keywords, "keywords must be present");
        Objects.requireNonNull(expertise, "expertise must be present");
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0 || Double.isNaN(confidenceThreshold)) {
            throw new IllegalArgumentException(
                "confidenceThreshold must be within [0,1] for agent " + id + ": " + confidenceThreshold);
        }
        if (historicalSuccessRate < 0.0 || historicalSuccessRate > 100.0 || Double.isNaN(historicalSuccessRate)) {
            throw new IllegalArgumentException(
                "historicalSuccessRate must be within [0,100] for agent " + id + ": " + historicalSuccessRate);
        }
        keywords = keywords.stream()
            .map(k -> requireText(k, "keyword").trim().toLowerCase(Locale.ROOT))
            .toList();
        expertise = expertise.stream()
            .map(e -> requireText(e, "expertise").trim())
            .toList();
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
