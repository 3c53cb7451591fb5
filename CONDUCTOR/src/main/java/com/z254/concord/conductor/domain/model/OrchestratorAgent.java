package com.z254.concord.conductor.domain.model;

import java.util.Set;

/**
 * The routing agent. Never a delegation target.
 */
public final class OrchestratorAgent extends Agent {

    public OrchestratorAgent(String slug, String name, String pubkey, String role) {
        super(slug, name, pubkey, role);
    }

    @Override
    public boolean isRoutable() {
        return false;
    }

    @Override
    public Set<AgentCapability> getCapabilities() {
        return Set.of();
    }

    @Override
    public String toString() {
        return "OrchestratorAgent[" + getSlug() + "]";
    }
}
