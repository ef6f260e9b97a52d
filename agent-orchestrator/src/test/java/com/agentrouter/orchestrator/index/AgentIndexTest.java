package com.agentrouter.orchestrator.index;

import com.agentrouter.common.exception.AgentIndexException;
import com.agentrouter.common.model.AgentProfile;
import com.agentrouter.common.routing.JitterSource;
import com.agentrouter.common.routing.QueryRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentIndexTest {

    private static final AgentProfile FALLBACK = new AgentProfile("general", "General Support", "General",
        List.of("help"), List.of("general support"), 0.5, 80.0);

    private static final String ONE_PROFILE = """
        [{"id": "billing", "name": "Billing", "category": "Billing",
          "keywords": ["refund"], "expertise": ["refund processing"],
          "confidenceThreshold": 0.4, "historicalSuccessRate": 90}]
        """;

    private static final String TWO_PROFILES = """
        [{"id": "billing", "name": "Billing", "category": "Billing",
          "keywords": ["refund"], "expertise": ["refund processing"],
          "confidenceThreshold": 0.4, "historicalSuccessRate": 90},
         {"id": "security", "name": "Security", "category": "Security",
          "keywords": ["breach"], "expertise": ["incident response"],
          "confidenceThreshold": 0.5, "historicalSuccessRate": 85}]
        """;

    private final AgentProfileLoader loader =
        new AgentProfileLoader(new DefaultResourceLoader(), new ObjectMapper());

    @TempDir
    Path dir;

    private AgentIndex index(Path file, AgentProfile fallback) {
        return new AgentIndex(loader, "file:" + file.toAbsolutePath(), Duration.ofMinutes(5), fallback,
                              Clock.systemUTC());
    }

    @Test
    @DisplayName("initial load installs the configured profiles")
    void initialLoad() throws IOException {
        Path file = Files.writeString(dir.resolve("agents.json"), TWO_PROFILES);
        AgentIndex index = index(file, FALLBACK);

        IndexSnapshot snapshot = index.load();

        assertFalse(snapshot.fallback());
        assertEquals(2, index.profiles().size());
        assertEquals(List.of("billing", "security"),
            index.profiles().stream().map(AgentProfile::id).toList());
    }

    @Test
    @DisplayName("unusable index on start falls back to the fallback profile")
    void fallbackOnStart() throws IOException {
        Path file = Files.writeString(dir.resolve("agents.json"), "{ not json");
        AgentIndex index = index(file, FALLBACK);

        IndexSnapshot snapshot = index.load();

        assertTrue(snapshot.fallback());
        assertEquals(List.of(FALLBACK), index.profiles());
    }

    @Test
    @DisplayName("without a fallback the index stays empty and routing is refused")
    void emptyWithoutFallback() {
        AgentIndex index = index(dir.resolve("missing.json"), null);

        index.load();

        assertTrue(index.profiles().isEmpty());
        assertThrows(AgentIndexException.class,
            () -> new QueryRouter(JitterSource.none(), "general").route("refund please", index.profiles()));
    }

    @Test
    @DisplayName("refresh swaps in the new generation")
    void refreshSwaps() throws IOException {
        Path file = Files.writeString(dir.resolve("agents.json"), ONE_PROFILE);
        AgentIndex index = index(file, FALLBACK);
        index.load();

        Files.writeString(file, TWO_PROFILES);
        index.refresh();

        assertEquals(2, index.profiles().size());
    }

    @Test
    @DisplayName("failed refresh keeps the previous snapshot")
    void refreshKeepsPrevious() throws IOException {
        Path file = Files.writeString(dir.resolve("agents.json"), TWO_PROFILES);
        AgentIndex index = index(file, FALLBACK);
        IndexSnapshot before = index.load();

        Files.writeString(file, "[]");

        assertThrows(AgentIndexException.class, index::refresh);
        assertSame(before, index.snapshot());
    }
}
