package com.z254.concord.conductor.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * An agent that receives delegated work, with an explicit capability set.
 */
public final class SpecialistAgent extends Agent {

    private final Set<AgentCapability> capabilities;

    public SpecialistAgent(String slug, String name, String pubkey, String role,
                           Set<AgentCapability> capabilities) {
        super(slug, name, pubkey, role);
        this.capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    @Override
    public boolean isRoutable() {
        return true;
    }

    @Override
    public Set<AgentCapability> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(AgentCapability capability) {
        return capabilities.contains(capability);
    }

    @Override
    public String toString() {
        return "SpecialistAgent[" + getSlug() + ", " + capabilities + "]";
    }
}
