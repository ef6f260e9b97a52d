package com.agentrouter.orchestrator.config;

import com.agentrouter.common.model.AgentProfile;
import com.agentrouter.common.routing.JitterSource;
import com.agentrouter.common.routing.QueryRouter;
import com.agentrouter.orchestrator.index.AgentIndex;
import com.agentrouter.orchestrator.index.AgentProfileLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${services.execution-backend.base-url}")
    private String executionBackendUrl;

    @Value("${routing.default-agent-id:}")
    private String defaultAgentId;

    @Value("${routing.agent-index.location:classpath:agents.json}")
    private String agentIndexLocation;

    @Value("${routing.agent-index.refresh-ttl:5m}")
    private Duration agentIndexRefreshTtl;

    // ── fallback profile used when the index cannot be loaded ──

    @Value("${routing.fallback-profile.id:}")
    private String fallbackId;

    @Value("${routing.fallback-profile.name:General Support}")
    private String fallbackName;

    @Value("${routing.fallback-profile.category:General}")
    private String fallbackCategory;

    @Value("${routing.fallback-profile.keywords:help,support}")
    private List<String> fallbackKeywords;

    @Value("${routing.fallback-profile.expertise:general support}")
    private List<String> fallbackExpertise;

    @Value("${routing.fallback-profile.confidence-threshold:0.5}")
    private double fallbackThreshold;

    @Value("${routing.fallback-profile.historical-success-rate:80}")
    private double fallbackSuccessRate;

    @Value("${services.execution-backend.connect-timeout:5s}")
    private Duration executionBackendConnectTimeout;

    @Bean
    public WebClient executionBackendClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) executionBackendConnectTimeout.toMillis());

        return builder
            .baseUrl(executionBackendUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JitterSource jitterSource() {
        return JitterSource.random(new SecureRandom());
    }

    @Bean
    public QueryRouter queryRouter(JitterSource jitterSource) {
        return new QueryRouter(jitterSource, defaultAgentId.isBlank() ? null : defaultAgentId);
    }

    @Bean
    public AgentIndex agentIndex(AgentProfileLoader loader, Clock clock) {
        AgentProfile fallback = fallbackId.isBlank() ? null : new AgentProfile(
            fallbackId, fallbackName, fallbackCategory, fallbackKeywords, fallbackExpertise,
            fallbackThreshold, fallbackSuccessRate);
        return new AgentIndex(loader, agentIndexLocation, agentIndexRefreshTtl, fallback, clock);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {} sessionId={}", clientRequest.method(), clientRequest.url(),
                      clientRequest.headers().getFirst("X-Session-Id"));
            return Mono.just(clientRequest);
        });
    }
}
