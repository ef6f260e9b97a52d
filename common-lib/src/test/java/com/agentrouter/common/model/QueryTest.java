package com.agentrouter.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("context entries with null values are kept")
    void nullContextValues() {
        Map<String, Object> context = new HashMap<>();
        context.put("customerTier", null);
        context.put("channel", "email");

        Query query = new Query("My webhook fails", "s-1", NOW, context);

        assertTrue(query.context().containsKey("customerTier"));
        assertNull(query.context().get("customerTier"));
        assertEquals("email", query.context().get("channel"));
    }

    @Test
    @DisplayName("context is a read-only copy of the caller's map")
    void contextIsCopied() {
        Map<String, Object> context = new HashMap<>();
        context.put("channel", "email");

        Query query = new Query("My webhook fails", "s-1", NOW, context);
        context.put("channel", "chat");

        assertEquals("email", query.context().get("channel"));
        assertThrows(UnsupportedOperationException.class, () -> query.context().put("x", 1));
    }

    @Test
    @DisplayName("missing context becomes an empty map")
    void missingContext() {
        assertTrue(new Query("My webhook fails", "s-1", NOW, null).context().isEmpty());
    }
}
