package com.z254.concord.conductor.orchestration;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.conversation.ConversationStore;
import com.z254.concord.conductor.delegation.DelegationService;
import com.z254.concord.conductor.network.EventPublisher;
import com.z254.concord.conductor.observability.StructuredLogger;
import com.z254.concord.conductor.phase.PhaseStateMachine;
import com.z254.concord.conductor.routing.RoutingEngine;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * The collaborators shared by the routing loop and the event handlers, assembled once at
 * startup and handed to them explicitly.
 */
@Component
@Getter
public class OrchestrationContext {

    private final ConversationStore store;
    private final PhaseStateMachine phaseStateMachine;
    private final DelegationService delegationService;
    private final RoutingEngine routingEngine;
    private final AgentRegistry registry;
    private final EventPublisher eventPublisher;
    private final StructuredLogger structuredLogger;
    private final ConductorProperties properties;

    public OrchestrationContext(
            ConversationStore store,
            PhaseStateMachine phaseStateMachine,
            DelegationService delegationService,
            RoutingEngine routingEngine,
            AgentRegistry registry,
            EventPublisher eventPublisher,
            StructuredLogger structuredLogger,
            ConductorProperties properties) {
        this.store = store;
        this.phaseStateMachine = phaseStateMachine;
        this.delegationService = delegationService;
        this.routingEngine = routingEngine;
        this.registry = registry;
        this.eventPublisher = eventPublisher;
        this.structuredLogger = structuredLogger;
        this.properties = properties;
    }
}
