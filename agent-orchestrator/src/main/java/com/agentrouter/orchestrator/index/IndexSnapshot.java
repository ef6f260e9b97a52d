package com.agentrouter.orchestrator.index;

import com.agentrouter.common.model.AgentProfile;

import java.time.Instant;
import java.util.List;

/**
 * One immutable generation of the agent index. {@code fallback} marks the single default
 * profile installed when the configured index could not be loaded.
 */
public record IndexSnapshot(List<AgentProfile> profiles, Instant loadedAt, boolean fallback) {

    static final IndexSnapshot EMPTY = new IndexSnapshot(List.of(), Instant.EPOCH, false);

    public IndexSnapshot {
        profiles = List.copyOf(profiles);
    }
}
