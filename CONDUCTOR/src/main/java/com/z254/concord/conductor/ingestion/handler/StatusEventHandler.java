package com.z254.concord.conductor.ingestion.handler;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.conversation.ConversationStore;
import com.z254.concord.conductor.domain.model.Agent;
import com.z254.concord.conductor.domain.model.AgentState;
import com.z254.concord.conductor.ingestion.EventCategory;
import com.z254.concord.conductor.network.EventTags;
import com.z254.concord.conductor.network.NetworkEvent;
import com.z254.concord.conductor.orchestration.OrchestrationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;

@Component
@Slf4j
public class StatusEventHandler implements EventHandler {

    private final ConversationStore store;
    private final AgentRegistry registry;

    public StatusEventHandler(OrchestrationContext context) {
        this.store = context.getStore();
        this.registry = context.getRegistry();
    }

    @Override
    public EventCategory category() {
        return EventCategory.STATUS;
    }

    @Override
    public Mono<Void> handle(NetworkEvent event) {
        Optional<Agent> agent = registry.findByPubkey(event.getPubkey());
        Optional<String> conversationId = event.tagValue(EventTags.CONVERSATION);
        if (agent.isEmpty() || conversationId.isEmpty()) {
            log.debug("Status event {} is not tied to a conversation", event.getId());
            return Mono.empty();
        }
        String status = event.tagValue(EventTags.STATUS).orElse(null);
        Instant at = Instant.ofEpochSecond(event.getCreatedAt());

        return store.find(conversationId.get())
                .flatMap(existing -> store.update(existing.getId(), conversation -> {
                    AgentState state = conversation.agentState(agent.get().getSlug());
                    state.setStatus(status);
                    state.setStatusMessage(event.getContent());
                    state.setLastActivityAt(at);
                }))
                .then();
    }
}
