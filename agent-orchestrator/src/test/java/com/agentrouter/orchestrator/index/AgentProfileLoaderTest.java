package com.agentrouter.orchestrator.index;

import com.agentrouter.common.exception.AgentIndexException;
import com.agentrouter.common.model.AgentProfile;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentProfileLoaderTest {

    private final AgentProfileLoader loader =
        new AgentProfileLoader(new DefaultResourceLoader(), new ObjectMapper());

    @TempDir
    Path dir;

    private String write(String json) throws IOException {
        Path file = dir.resolve("agents.json");
        Files.writeString(file, json);
        return "file:" + file.toAbsolutePath();
    }

    @Test
    @DisplayName("loads every profile from the classpath")
    void loadsClasspath() {
        List<AgentProfile> profiles = loader.load("classpath:agents-test.json");
        assertEquals(List.of("billing", "security", "general"), profiles.stream().map(AgentProfile::id).toList());
        assertEquals(0.35, profiles.get(0).confidenceThreshold(), 1e-9);
    }

    @Test
    @DisplayName("missing resource is reported")
    void missing() {
        AgentIndexException e = assertThrows(AgentIndexException.class,
            () -> loader.load("classpath:no-such-index.json"));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("duplicate ids reject the whole file")
    void duplicates() {
        AgentIndexException e = assertThrows(AgentIndexException.class,
            () -> loader.load("classpath:agents-duplicate.json"));
        assertTrue(e.getMessage().contains("Duplicate agent id 'billing'"));
    }

    @Test
    @DisplayName("a profile missing a field is rejected")
    void missingField() throws IOException {
        String location = write("""
            [{"id": "billing", "name": "Billing", "category": "Billing",
              "keywords": ["refund"], "expertise": ["refunds"], "confidenceThreshold": 0.4}]
            """);
        assertThrows(AgentIndexException.class, () -> loader.load(location));
    }

    @Test
    @DisplayName("an out-of-range threshold is rejected")
    void invalidThreshold() throws IOException {
        String location = write("""
            [{"id": "billing", "name": "Billing", "category": "Billing",
              "keywords": ["refund"], "expertise": ["refunds"],
              "confidenceThreshold": 1.5, "historicalSuccessRate": 90}]
            """);
        assertThrows(AgentIndexException.class, () -> loader.load(location));
    }

    @Test
    @DisplayName("unknown fields and empty arrays are rejected")
    void unknownFieldsAndEmpty() throws IOException {
        String unknown = write("""
            [{"id": "billing", "name": "Billing", "category": "Billing",
              "keywords": ["refund"], "expertise": ["refunds"],
              "confidenceThreshold": 0.4, "historicalSuccessRate": 90, "tier": "gold"}]
            """);
        assertThrows(AgentIndexException.class, () -> loader.load(unknown));

        String empty = write("[]");
        assertThrows(AgentIndexException.class, () -> loader.load(empty));
    }
}
