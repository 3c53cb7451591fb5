package com.z254.concord.conductor.agent;

import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.config.ConductorProperties.AgentKind;
import com.z254.concord.conductor.domain.model.Agent;
import com.z254.concord.conductor.domain.model.OrchestratorAgent;
import com.z254.concord.conductor.domain.model.SpecialistAgent;
import com.z254.concord.conductor.network.AgentIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The known agent set. Slugs are lowercase and unique; the orchestrator's public key is the
 * conductor's own signing identity.
 */
@Component
@Slf4j
public class AgentRegistry {

    public static final String DEFAULT_ORCHESTRATOR_SLUG = "orchestrator";

    private final OrchestratorAgent orchestrator;
    private final Map<String, Agent> bySlug;
    private final Map<String, Agent> byPubkey;

    @Autowired
    public AgentRegistry(ConductorProperties properties, AgentIdentity orchestratorIdentity) {
        this(fromProperties(properties.getAgents(), orchestratorIdentity));
    }

    public AgentRegistry(List<Agent> agents) {
        Map<String, Agent> slugs = new LinkedHashMap<>();
        Map<String, Agent> pubkeys = new LinkedHashMap<>();
        OrchestratorAgent found = null;
        for (Agent agent : agents) {
            if (slugs.putIfAbsent(agent.getSlug(), agent) != null) {
                throw new IllegalArgumentException("Duplicate agent slug: " + agent.getSlug());
            }
            if (StringUtils.hasText(agent.getPubkey())) {
                pubkeys.put(agent.getPubkey(), agent);
            }
            if (agent instanceof OrchestratorAgent orchestratorAgent) {
                if (found != null) {
                    throw new IllegalArgumentException("More than one orchestrator agent configured");
                }
                found = orchestratorAgent;
            }
        }
        if (found == null) {
            throw new IllegalArgumentException("No orchestrator agent configured");
        }
        this.orchestrator = found;
        this.bySlug = Collections.unmodifiableMap(slugs);
        this.byPubkey = Collections.unmodifiableMap(pubkeys);
        log.info("Registered {} agents: {}", slugs.size(), slugs.keySet());
    }

    public OrchestratorAgent orchestrator() {
        return orchestrator;
    }

    public Optional<Agent> find(String slug) {
        return slug == null ? Optional.empty() : Optional.ofNullable(bySlug.get(normalize(slug)));
    }

    public Optional<Agent> findByPubkey(String pubkey) {
        return pubkey == null ? Optional.empty() : Optional.ofNullable(byPubkey.get(pubkey));
    }

    public boolean isKnown(String slug) {
        return find(slug).isPresent();
    }

    /**
     * Agents a routing decision may target, in configuration order.
     */
    public List<SpecialistAgent> specialists() {
        return bySlug.values().stream()
                .filter(Agent::isRoutable)
                .map(SpecialistAgent.class::cast)
                .toList();
    }

    public Set<String> routableSlugs() {
        return specialists().stream()
                .map(Agent::getSlug)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Public keys of every agent other than the orchestrator.
     */
    public Set<String> specialistPubkeys() {
        return specialists().stream()
                .map(Agent::getPubkey)
                .filter(StringUtils::hasText)
                .collect(Collectors.toSet());
    }

    public List<Agent> all() {
        return List.copyOf(bySlug.values());
    }

    public static String normalize(String slug) {
        return slug.trim().toLowerCase(Locale.ROOT);
    }

    private static List<Agent> fromProperties(List<ConductorProperties.AgentProperties> configured,
                                              AgentIdentity orchestratorIdentity) {
        List<Agent> agents = new ArrayList<>();
        boolean orchestratorConfigured = false;
        for (ConductorProperties.AgentProperties props : configured) {
            String slug = normalize(props.getSlug());
            if (props.getKind() == AgentKind.ORCHESTRATOR) {
                orchestratorConfigured = true;
                agents.add(new OrchestratorAgent(slug, props.getName(),
                        orchestratorIdentity.publicKeyHex(), props.getRole()));
            } else {
                agents.add(new SpecialistAgent(slug, props.getName(),
                        StringUtils.hasText(props.getPubkey()) ? props.getPubkey() : null,
                        props.getRole(), props.getCapabilities()));
            }
        }
        if (!orchestratorConfigured) {
            agents.add(0, new OrchestratorAgent(DEFAULT_ORCHESTRATOR_SLUG, "Orchestrator",
                    orchestratorIdentity.publicKeyHex(), "Routes work between agents"));
        }
        return agents;
    }
}
