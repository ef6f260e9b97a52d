package com.agentrouter.orchestrator.session;

import com.agentrouter.common.model.AgentRuntimeState;
import com.agentrouter.common.model.AgentStatus;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds one agent's {@link AgentRuntimeState} inside a session.
 *
 * <p>Written only by the task running that agent; everyone else reads immutable snapshots.
 * Once the state is terminal the slot is frozen and further writes are ignored.
 */
public final class AgentSlot {

    private final String agentId;
    private final String agentName;
    private final AtomicReference<AgentRuntimeState> state;

    AgentSlot(String agentId, String agentName, Instant now) {
        this.agentId   = agentId;
        this.agentName = agentName;
        this.state     = new AtomicReference<>(AgentRuntimeState.idle(agentId, agentName, now));
    }

    public String agentId() {
        return agentId;
    }

    public String agentName() {
        return agentName;
    }

    public AgentRuntimeState current() {
        return state.get();
    }

    public boolean isSettled() {
        return state.get().isTerminal();
    }

    /** @return the new snapshot, or empty when the slot already settled */
    public Optional<AgentRuntimeState> advance(AgentStatus next, double progress, String task, Instant now) {
        return apply(s -> s.advance(next, progress, task, now));
    }

    /** @return the ERROR snapshot, or empty when the slot already settled */
    public Optional<AgentRuntimeState> fail(String reason, Instant now) {
        return apply(s -> s.fail(reason, now));
    }

    private Optional<AgentRuntimeState> apply(UnaryOperator<AgentRuntimeState> step) {
        while (true) {
            AgentRuntimeState previous = state.get();
            if (previous.isTerminal()) {
                return Optional.empty();
            }
            AgentRuntimeState next = step.apply(previous);
            if (state.compareAndSet(previous, next)) {
                return Optional.of(next);
            }
        }
    }
}
