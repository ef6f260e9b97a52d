package com.agentrouter.orchestrator.controller;

import com.agentrouter.orchestrator.index.AgentIndex;
import com.agentrouter.orchestrator.index.IndexSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentIndex agentIndex;

    public AgentController(AgentIndex agentIndex) {
        this.agentIndex = agentIndex;
    }

    @GetMapping
    public Mono<ResponseEntity<IndexSnapshot>> list() {
        return Mono.fromCallable(agentIndex::snapshot).map(ResponseEntity::ok);
    }

    /** Reloads the index now; on failure the current snapshot stays and 503 is returned. */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<IndexSnapshot>> refresh() {
        return Mono.fromCallable(agentIndex::refresh)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }
}
