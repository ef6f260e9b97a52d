package com.agentrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A free-text support query bound to the session created for it.
 *
 * <p>{@code context} is caller-supplied metadata passed through to the execution backend as is;
 * null values are kept.
 */
public record Query(
    @JsonProperty("text")      String text,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("context")   Map<String, Object> context
) {
    public Query {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
