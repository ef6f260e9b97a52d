package com.agentrouter.orchestrator.backend;

import com.agentrouter.common.collaborator.ExecutionBackend;
import com.agentrouter.common.exception.AgentTaskException;
import com.agentrouter.common.model.AgentResult;
import com.agentrouter.common.model.Query;
import com.agentrouter.common.trace.SessionLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * HTTP implementation of {@link ExecutionBackend}.
 *
 * <p>POSTs the query to {@code /api/v1/agents/{agentId}/execute} on the execution backend and
 * expects {@code {"content": "...", "confidence": 0.0–1.0}} back. Any transport or HTTP error
 * surfaces as an {@link AgentTaskException} for that agent.
 */
@Component
public class RestExecutionBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(RestExecutionBackend.class);

    private final WebClient executionBackendClient;

    public RestExecutionBackend(WebClient executionBackendClient) {
        this.executionBackendClient = executionBackendClient;
    }

    @Override
    public Mono<AgentResult> execute(String agentId, Query query, String sessionId) {
        ExecutionRequest request = new ExecutionRequest(agentId, sessionId, query.text(), query.context());
        return executionBackendClient.post()
            .uri("/api/v1/agents/{agentId}/execute", agentId)
            .header("X-Session-Id", sessionId)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(AgentResult.class)
            .doOnNext(r -> SessionLogContext.log(sessionId, agentId, () ->
                log.info("Execution backend responded. agentId={} sessionId={} confidence={}",
                         agentId, sessionId, r.confidence())))
            .onErrorMap(e -> !(e instanceof AgentTaskException),
                        e -> new AgentTaskException(agentId, "Execution backend call failed: " + e.getMessage(), e));
    }

    record ExecutionRequest(String agentId, String sessionId, String query, Map<String, Object> context) {}
}
