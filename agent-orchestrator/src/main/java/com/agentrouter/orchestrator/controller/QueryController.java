package com.agentrouter.orchestrator.controller;

import com.agentrouter.common.model.RoutingDecision;
import com.agentrouter.orchestrator.service.OrchestrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/queries")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final OrchestrationService orchestrationService;

    public QueryController(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    @PostMapping
    public Mono<ResponseEntity<QueryTicket>> submit(@RequestBody QueryRequest request) {
        return Mono.fromCallable(() -> orchestrationService.submitQuery(request.text(), request.context()))
            .map(session -> ResponseEntity.accepted().body(QueryTicket.of(session)))
            .doOnNext(r -> log.info("Query accepted. sessionId={} agents={}",
                                    r.getBody().sessionId(), r.getBody().selectedAgentIds()));
    }

    @PostMapping("/analyze")
    public Mono<ResponseEntity<RoutingDecision>> analyze(@RequestBody QueryRequest request) {
        return Mono.fromCallable(() -> orchestrationService.analyze(request.text()))
            .map(ResponseEntity::ok);
    }
}
