package com.agentrouter.orchestrator.controller;

import com.agentrouter.common.model.EscalationRecord;
import com.agentrouter.orchestrator.escalation.OperatorEscalationChannel;
import com.agentrouter.orchestrator.exception.SessionNotFoundException;
import com.agentrouter.orchestrator.service.OrchestrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/escalations")
public class EscalationController {

    private static final Logger log = LoggerFactory.getLogger(EscalationController.class);

    private final OrchestrationService orchestrationService;
    private final OperatorEscalationChannel operatorChannel;

    public EscalationController(OrchestrationService orchestrationService,
                                OperatorEscalationChannel operatorChannel) {
        this.orchestrationService = orchestrationService;
        this.operatorChannel      = operatorChannel;
    }

    @GetMapping
    public Flux<EscalationRecord> pending() {
        return Flux.defer(() -> Flux.fromIterable(orchestrationService.pendingEscalations()));
    }

    @PostMapping("/{sessionId}/resolve")
    public Mono<ResponseEntity<Map<String, Object>>> resolve(@PathVariable String sessionId,
                                                             @RequestBody ResolveEscalationRequest request) {
        return Mono.fromCallable(() -> {
            if (request.response() == null || request.response().isBlank()) {
                throw new IllegalArgumentException("Escalation response must not be empty");
            }
            orchestrationService.session(sessionId);
            if (!operatorChannel.resolve(sessionId, request.response())) {
                throw new SessionNotFoundException("No pending escalation for session " + sessionId);
            }
            log.info("Escalation answered by operator. sessionId={} operatorId={}",
                     sessionId, request.operatorId());
            return ResponseEntity.ok(Map.<String, Object>of("sessionId", sessionId, "accepted", true));
        });
    }
}
