package com.z254.concord.conductor.domain.model;

/**
 * Capabilities a specialist agent advertises to the routing prompt.
 */
public enum AgentCapability {
    TOOLS,
    RETRIEVAL,
    FILE_EDIT,
    SCHEDULING
}
