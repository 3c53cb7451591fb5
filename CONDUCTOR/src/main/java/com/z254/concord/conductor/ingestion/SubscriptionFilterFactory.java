package com.z254.concord.conductor.ingestion;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.network.EventFilter;
import com.z254.concord.conductor.network.EventKind;
import com.z254.concord.conductor.network.EventTags;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds the ingestion subscription: traffic addressed to the orchestrator, everything the
 * known agents publish, and conversation traffic from configured users.
 */
@Component
public class SubscriptionFilterFactory {

    private static final List<Integer> CONVERSATION_KINDS = List.of(
            EventKind.TEXT_NOTE.getCode(),
            EventKind.CONVERSATION_ROOT.getCode(),
            EventKind.GENERIC_REPLY.getCode());

    private static final List<Integer> AGENT_KINDS = List.of(
            EventKind.TEXT_NOTE.getCode(),
            EventKind.GENERIC_REPLY.getCode(),
            EventKind.AGENT_STATUS.getCode(),
            EventKind.AUXILIARY_RECORD.getCode());

    private final AgentRegistry registry;
    private final ConductorProperties.IngestionProperties config;

    public SubscriptionFilterFactory(AgentRegistry registry, ConductorProperties properties) {
        this.registry = registry;
        this.config = properties.getIngestion();
    }

    public List<EventFilter> filters() {
        List<EventFilter> filters = new ArrayList<>();
        filters.add(EventFilter.builder()
                .kinds(CONVERSATION_KINDS)
                .tag(EventTags.RECIPIENT, Set.of(registry.orchestrator().getPubkey()))
                .limit(config.getReplayLimit())
                .build());

        Set<String> agentKeys = registry.specialistPubkeys();
        if (!agentKeys.isEmpty()) {
            filters.add(EventFilter.builder()
                    .authors(agentKeys)
                    .kinds(AGENT_KINDS)
                    .limit(config.getReplayLimit())
                    .build());
        }

        if (!config.getUserPubkeys().isEmpty()) {
            filters.add(EventFilter.builder()
                    .authors(config.getUserPubkeys())
                    .kinds(CONVERSATION_KINDS)
                    .limit(config.getReplayLimit())
                    .build());
        }
        return filters;
    }
}
