package com.agentrouter.common.collaborator;

import com.agentrouter.common.model.EscalationRecord;
import reactor.core.publisher.Mono;

/**
 * Hands a pending escalation to a human operator.
 *
 * <p>The returned {@link Mono} emits the operator's response text whenever it arrives; no
 * latency bound is implied. Timeouts are applied by the caller.
 */
public interface HumanEscalationChannel {

    Mono<String> escalate(EscalationRecord record);
}
