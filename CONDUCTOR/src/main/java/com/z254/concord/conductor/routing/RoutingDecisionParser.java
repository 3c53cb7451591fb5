package com.z254.concord.conductor.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.domain.model.Phase;
import com.z254.concord.conductor.domain.model.RoutingDecision;
import com.z254.concord.conductor.exception.ValidationException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses and validates the completion service's routing answer.
 *
 * <p>Expected shape: {@code {"agents": ["slug", ...], "phase": "PLAN", "reason": "..."}}.
 * {@code phase} is optional. {@code ["END"]} on its own ends the workflow.
 */
@Component
public class RoutingDecisionParser {

    private final ObjectMapper objectMapper;
    private final AgentRegistry registry;

    public RoutingDecisionParser(ObjectMapper objectMapper, AgentRegistry registry) {
        this.objectMapper = objectMapper;
        this.registry = registry;
    }

    /**
     * @throws ValidationException when the answer is not valid JSON, misses a field, or names
     *                             an agent that cannot be routed to
     */
    public RoutingDecision parse(String content) {
        if (!StringUtils.hasText(content)) {
            throw new ValidationException("Routing decision is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content.trim());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Routing decision is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Routing decision must be a JSON object");
        }

        List<String> agents = parseAgents(root.get("agents"));
        String reason = parseReason(root.get("reason"));
        String phase = parsePhase(root.get("phase"));

        if (agents.contains(RoutingDecision.END)) {
            if (agents.size() > 1) {
                throw new ValidationException("END cannot be combined with other agents: " + agents);
            }
            return RoutingDecision.builder().agents(agents).phase(phase).reason(reason).build();
        }

        Set<String> routable = registry.routableSlugs();
        List<String> unknown = agents.stream()
                .filter(agent -> !routable.contains(agent))
                .toList();
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown agents in routing decision: " + unknown
                    + "; available: " + routable);
        }
        return RoutingDecision.builder().agents(agents).phase(phase).reason(reason).build();
    }

    private List<String> parseAgents(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new ValidationException("Routing decision needs a non-empty 'agents' array");
        }
        Set<String> agents = new LinkedHashSet<>();
        for (JsonNode element : node) {
            if (!element.isTextual() || !StringUtils.hasText(element.asText())) {
                throw new ValidationException("Agent entries must be non-blank strings");
            }
            String value = element.asText().trim();
            agents.add(RoutingDecision.END.equalsIgnoreCase(value) ? RoutingDecision.END : AgentRegistry.normalize(value));
        }
        return new ArrayList<>(agents);
    }

    private String parseReason(JsonNode node) {
        if (node == null || !node.isTextual() || !StringUtils.hasText(node.asText())) {
            throw new ValidationException("Routing decision needs a non-blank 'reason'");
        }
        return node.asText().trim();
    }

    private String parsePhase(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ValidationException("'phase' must be a string");
        }
        String phase = Phase.normalize(node.asText());
        return StringUtils.hasText(phase) ? phase : null;
    }
}
