package com.z254.concord.conductor.ingestion.handler;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.conversation.ConversationStore;
import com.z254.concord.conductor.domain.model.Agent;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.ConversationMessage;
import com.z254.concord.conductor.ingestion.EventCategory;
import com.z254.concord.conductor.network.EventTags;
import com.z254.concord.conductor.network.NetworkEvent;
import com.z254.concord.conductor.orchestration.ConversationOrchestrator;
import com.z254.concord.conductor.orchestration.OrchestrationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Appends conversation traffic to the history. A root event starts a conversation; a user
 * message starts the routing loop unless one is already running for the conversation.
 */
@Component
@Slf4j
public class MessageEventHandler implements EventHandler {

    private static final int TITLE_LENGTH = 60;

    private final ConversationStore store;
    private final AgentRegistry registry;
    private final ConversationOrchestrator orchestrator;
    private final Set<String> userPubkeys;

    public MessageEventHandler(OrchestrationContext context, ConversationOrchestrator orchestrator) {
        this.store = context.getStore();
        this.registry = context.getRegistry();
        this.orchestrator = orchestrator;
        this.userPubkeys = context.getProperties().getIngestion().getUserPubkeys();
    }

    @Override
    public EventCategory category() {
        return EventCategory.MESSAGE;
    }

    @Override
    public Mono<Void> handle(NetworkEvent event) {
        String conversationId = event.tagValue(EventTags.CONVERSATION).orElse(event.getId());
        Optional<Agent> agent = registry.findByPubkey(event.getPubkey());
        boolean fromUser = agent.isEmpty() && (userPubkeys.isEmpty() || userPubkeys.contains(event.getPubkey()));
        if (agent.isEmpty() && !fromUser) {
            log.debug("Ignoring message {} from unknown author {}", event.getId(), event.getPubkey());
            return Mono.empty();
        }

        ConversationMessage message = ConversationMessage.builder()
                .id(event.getId())
                .role(fromUser ? ConversationMessage.ROLE_USER : ConversationMessage.ROLE_AGENT)
                .author(agent.map(Agent::getSlug).orElse(event.getPubkey()))
                .content(event.getContent())
                .timestamp(Instant.ofEpochSecond(event.getCreatedAt()))
                .build();

        return store.getOrCreate(conversationId, () -> Conversation.builder()
                        .title(title(event))
                        .build())
                .flatMap(conversation -> {
                    boolean startLoop = fromUser && !orchestrator.isRunning(conversationId);
                    return store.update(conversationId, current -> {
                        message.setPhase(current.getPhase());
                        current.appendMessage(message);
                        if (startLoop) {
                            current.setOriginalRequest(event.getContent());
                        }
                    }).doOnNext(updated -> {
                        if (startLoop && orchestrator.start(conversationId)) {
                            log.info("Started routing for {} on message {}", conversationId, event.getId());
                        }
                    });
                })
                .then();
    }

    private String title(NetworkEvent event) {
        Optional<String> tagged = event.tagValue(EventTags.TITLE).filter(StringUtils::hasText);
        if (tagged.isPresent()) {
            return tagged.get();
        }
        String content = event.getContent() == null ? "" : event.getContent().strip();
        int newline = content.indexOf('\n');
        String firstLine = newline >= 0 ? content.substring(0, newline) : content;
        return firstLine.length() > TITLE_LENGTH ? firstLine.substring(0, TITLE_LENGTH) + "..." : firstLine;
    }
}
