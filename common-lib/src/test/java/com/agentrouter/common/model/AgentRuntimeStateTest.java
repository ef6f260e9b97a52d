package com.agentrouter.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AgentRuntimeStateTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final AgentRuntimeState idle = AgentRuntimeState.idle("technical", "Technical Support", T0);

    @Nested
    @DisplayName("transitions")
    class TransitionTests {

        @Test
        @DisplayName("forward moves bump the sequence")
        void forwardMoves() {
            AgentRuntimeState analyzing = idle.advance(AgentStatus.ANALYZING, 10, "Analyzing query", T0);
            AgentRuntimeState processing = analyzing.advance(AgentStatus.PROCESSING, 25, null, T0);

            assertEquals(AgentStatus.PROCESSING, processing.status());
            assertEquals(2L, processing.sequence());
            assertEquals("Analyzing query", processing.currentTask());
        }

        @Test
        @DisplayName("skipping COLLABORATING is allowed")
        void forwardSkip() {
            AgentRuntimeState processing = idle.advance(AgentStatus.PROCESSING, 25, "Working", T0);
            assertDoesNotThrow(() -> processing.advance(AgentStatus.COMPLETING, 90, "Wrapping up", T0));
        }

        @Test
        @DisplayName("moving backwards is rejected")
        void backwardsRejected() {
            AgentRuntimeState processing = idle.advance(AgentStatus.PROCESSING, 25, "Working", T0);
            assertThrows(IllegalStateException.class,
                () -> processing.advance(AgentStatus.ANALYZING, 30, null, T0));
        }

        @Test
        @DisplayName("terminal states are final")
        void terminalIsFinal() {
            AgentRuntimeState finished = idle.advance(AgentStatus.FINISHED, 100, "Done", T0);
            assertTrue(finished.isTerminal());
            assertThrows(IllegalStateException.class, () -> finished.advance(AgentStatus.ERROR, 0, null, T0));
            assertThrows(IllegalStateException.class, () -> finished.advance(AgentStatus.FINISHED, 100, null, T0));
        }

        @Test
        @DisplayName("fail() records the reason")
        void failRecordsReason() {
            AgentRuntimeState failed = idle.advance(AgentStatus.PROCESSING, 40, "Working", T0)
                .fail("backend timeout", T0);
            assertEquals(AgentStatus.ERROR, failed.status());
            assertEquals("backend timeout", failed.detail());
            assertEquals(40.0, failed.progress(), 1e-9);
        }
    }

    @Nested
    @DisplayName("progress")
    class ProgressTests {

        @Test
        @DisplayName("never decreases within a status")
        void monotonicWithinStatus() {
            AgentRuntimeState s = idle.advance(AgentStatus.PROCESSING, 60, "Working", T0)
                .advance(AgentStatus.PROCESSING, 40, null, T0);
            assertEquals(60.0, s.progress(), 1e-9);
        }

        @Test
        @DisplayName("clamped to [0,100]")
        void clamped() {
            assertEquals(100.0, idle.advance(AgentStatus.PROCESSING, 140, null, T0).progress(), 1e-9);
            assertEquals(0.0, idle.advance(AgentStatus.ANALYZING, -5, null, T0).progress(), 1e-9);
        }
    }
}
