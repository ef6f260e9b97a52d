package com.agentrouter.orchestrator.index;

import com.agentrouter.common.exception.AgentIndexException;
import com.agentrouter.common.model.AgentProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a JSON array of {@link AgentProfile} from a Spring resource location
 * ({@code classpath:agents.json}, {@code file:/etc/router/agents.json}).
 *
 * <p>Every profile field is required: a missing or null field, an out-of-range threshold or a
 * duplicate id rejects the whole file so a malformed profile never reaches scoring.
 */
@Component
public class AgentProfileLoader {

    private static final Logger log = LoggerFactory.getLogger(AgentProfileLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectReader reader;

    public AgentProfileLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.reader = objectMapper.readerFor(new TypeReference<List<AgentProfile>>() {})
            .with(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES,
                  DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES,
                  DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES,
                  DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws AgentIndexException when the resource is missing, unreadable or invalid
     */
    public List<AgentProfile> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new AgentIndexException("Agent index not found at " + location);
        }
        List<AgentProfile> profiles;
        try (InputStream in = resource.getInputStream()) {
            profiles = reader.readValue(in);
        } catch (IOException e) {
            throw new AgentIndexException("Invalid agent index at " + location + ": " + describe(e), e);
        }
        if (profiles == null || profiles.isEmpty()) {
            throw new AgentIndexException("Agent index at " + location + " holds no profiles");
        }
        Set<String> ids = new HashSet<>();
        for (AgentProfile profile : profiles) {
            if (profile == null) {
                throw new AgentIndexException("Null profile entry in " + location);
            }
            if (!ids.add(profile.id())) {
                throw new AgentIndexException("Duplicate agent id '" + profile.id() + "' in " + location);
            }
        }
        log.info("Agent profiles loaded. location={} count={}", location, profiles.size());
        return List.copyOf(profiles);
    }

    private static String describe(IOException e) {
        if (e instanceof JsonProcessingException) {
            return ((JsonProcessingException) e).getOriginalMessage();
        }
        return e.getMessage();
    }
}
