package com.z254.concord.conductor.ingestion.handler;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.conversation.ConversationStore;
import com.z254.concord.conductor.domain.model.Agent;
import com.z254.concord.conductor.ingestion.EventCategory;
import com.z254.concord.conductor.network.EventTags;
import com.z254.concord.conductor.network.NetworkEvent;
import com.z254.concord.conductor.orchestration.OrchestrationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attaches lessons, reports and similar records to the conversation's metadata under
 * {@value #RECORDS_KEY}.
 */
@Component
@Slf4j
public class AuxiliaryEventHandler implements EventHandler {

    public static final String RECORDS_KEY = "records";

    private final ConversationStore store;
    private final AgentRegistry registry;

    public AuxiliaryEventHandler(OrchestrationContext context) {
        this.store = context.getStore();
        this.registry = context.getRegistry();
    }

    @Override
    public EventCategory category() {
        return EventCategory.AUXILIARY;
    }

    @Override
    public Mono<Void> handle(NetworkEvent event) {
        Optional<String> conversationId = event.tagValue(EventTags.CONVERSATION);
        if (conversationId.isEmpty()) {
            log.debug("Auxiliary record {} has no conversation tag", event.getId());
            return Mono.empty();
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("eventId", event.getId());
        record.put("type", event.tagValue(EventTags.RECORD_TYPE).orElse("record"));
        record.put("author", registry.findByPubkey(event.getPubkey()).map(Agent::getSlug).orElse(event.getPubkey()));
        record.put("content", event.getContent());
        record.put("createdAt", Instant.ofEpochSecond(event.getCreatedAt()).toString());

        return store.find(conversationId.get())
                .flatMap(existing -> store.update(existing.getId(), conversation -> {
                    List<Object> records = new ArrayList<>();
                    if (conversation.getMetadata() != null
                            && conversation.getMetadata().get(RECORDS_KEY) instanceof List<?> stored) {
                        records.addAll(stored);
                    }
                    records.add(record);
                    conversation.putMetadata(RECORDS_KEY, records);
                }))
                .then();
    }
}
