package com.z254.concord.conductor.domain.model;

import lombok.Getter;

import java.util.Set;

/**
 * A participant on the event network, identified by slug and signing public key.
 * Either the {@link OrchestratorAgent} that routes work or a {@link SpecialistAgent} that
 * receives it.
 */
@Getter
public abstract sealed class Agent permits OrchestratorAgent, SpecialistAgent {

    private final String slug;
    private final String name;
    private final String pubkey;
    private final String role;

    protected Agent(String slug, String name, String pubkey, String role) {
        this.slug = slug;
        this.name = name != null ? name : slug;
        this.pubkey = pubkey;
        this.role = role;
    }

    /**
     * Whether routing decisions may target this agent.
     */
    public abstract boolean isRoutable();

    public abstract Set<AgentCapability> getCapabilities();
}
