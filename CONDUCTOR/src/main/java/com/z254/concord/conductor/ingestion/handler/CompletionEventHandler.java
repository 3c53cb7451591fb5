package com.z254.concord.conductor.ingestion.handler;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.conversation.CompletionMode;
import com.z254.concord.conductor.delegation.DelegationService;
import com.z254.concord.conductor.domain.model.Agent;
import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.exception.OrphanedCompletionException;
import com.z254.concord.conductor.ingestion.EventCategory;
import com.z254.concord.conductor.network.EventTags;
import com.z254.concord.conductor.network.NetworkEvent;
import com.z254.concord.conductor.observability.StructuredLogger;
import com.z254.concord.conductor.orchestration.OrchestrationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;

/**
 * Records agent replies on their routing turn. Replies that match no open turn are logged
 * as orphaned and dropped.
 */
@Component
@Slf4j
public class CompletionEventHandler implements EventHandler {

    private final DelegationService delegationService;
    private final AgentRegistry registry;
    private final StructuredLogger structuredLogger;

    public CompletionEventHandler(OrchestrationContext context) {
        this.delegationService = context.getDelegationService();
        this.registry = context.getRegistry();
        this.structuredLogger = context.getStructuredLogger();
    }

    @Override
    public EventCategory category() {
        return EventCategory.COMPLETION;
    }

    @Override
    public Mono<Void> handle(NetworkEvent event) {
        Optional<String> conversationId = event.tagValue(EventTags.CONVERSATION);
        Optional<Agent> agent = registry.findByPubkey(event.getPubkey());
        if (conversationId.isEmpty() || agent.isEmpty()) {
            log.warn("Dropping reply {} without conversation tag or known author", event.getId());
            return Mono.empty();
        }
        String turnId = event.tagValue(EventTags.TURN).orElse(null);
        structuredLogger.setConversationContext(conversationId.get(), turnId, agent.get().getSlug());
        Completion completion = Completion.builder()
                .agent(agent.get().getSlug())
                .content(event.getContent())
                .timestamp(Instant.ofEpochSecond(event.getCreatedAt()))
                .eventId(event.getId())
                .build();

        return delegationService.recordCompletion(conversationId.get(), turnId, completion, CompletionMode.STRICT)
                .onErrorResume(OrphanedCompletionException.class, e -> {
                    structuredLogger.logOrphanedCompletion(e.getConversationId(), e.getTurnId(), e.getAgent(),
                            e.getMessage());
                    return Mono.empty();
                })
                .then();
    }
}
