package com.agentrouter.common.collaborator;

import com.agentrouter.common.model.AgentResult;
import com.agentrouter.common.model.Query;
import reactor.core.publisher.Mono;

/**
 * Opaque backend that performs an agent's specialised work.
 *
 * <p>Invoked once per dispatched agent. Implementations MUST be non-blocking; failures are
 * signalled as errors on the returned {@link Mono} and are isolated to that agent by the
 * caller. Cancelling the subscription abandons the call.
 */
public interface ExecutionBackend {

    Mono<AgentResult> execute(String agentId, Query query, String sessionId);
}
