package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of one execution backend call.
 */
public record AgentResult(
    @JsonProperty("content")    String content,
    @JsonProperty("confidence") double confidence
) {}
