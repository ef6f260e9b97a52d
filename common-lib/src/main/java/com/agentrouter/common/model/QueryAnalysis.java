package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Text-derived signals used by scoring and escalation.
 *
 * @param keywords        up to eight distinct content tokens in first-seen order
 * @param complexity      bucketed complexity
 * @param complexityScore raw score the bucket was derived from
 * @param sentiment       positive lexicon hits minus negative lexicon hits
 */
public record QueryAnalysis(
    @JsonProperty("keywords")        List<String> keywords,
    @JsonProperty("complexity")      Complexity complexity,
    @JsonProperty("complexityScore") double complexityScore,
    @JsonProperty("sentiment")       int sentiment
) {
    public QueryAnalysis {
        keywords = List.copyOf(keywords);
    }
}
