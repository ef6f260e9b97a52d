package com.agentrouter.orchestrator.websocket;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping agentTrackingHandlerMapping(AgentTrackingWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of("/ws/agent-tracking/*", handler), -1);
    }
}
