package com.z254.concord.conductor.ingestion;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.domain.model.Agent;
import com.z254.concord.conductor.network.EventKind;
import com.z254.concord.conductor.network.EventTags;
import com.z254.concord.conductor.network.NetworkEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps an event to its {@link EventCategory} from kind, author and tags.
 */
@Component
public class EventClassifier {

    private final AgentRegistry registry;

    public EventClassifier(AgentRegistry registry) {
        this.registry = registry;
    }

    public EventCategory classify(NetworkEvent event) {
        Optional<EventKind> kind = event.knownKind();
        if (kind.isEmpty() || kind.get().isTypingIndicator()) {
            return EventCategory.IGNORED;
        }
        Optional<Agent> author = registry.findByPubkey(event.getPubkey());
        if (author.isPresent() && !author.get().isRoutable()) {
            // our own events echoed back
            return EventCategory.IGNORED;
        }

        return switch (kind.get()) {
            case AGENT_STATUS -> author.isPresent() ? EventCategory.STATUS : EventCategory.IGNORED;
            case AUXILIARY_RECORD -> EventCategory.AUXILIARY;
            case TEXT_NOTE, GENERIC_REPLY -> author.isPresent() && isReply(event)
                    ? EventCategory.COMPLETION
                    : EventCategory.MESSAGE;
            case CONVERSATION_ROOT -> EventCategory.MESSAGE;
            default -> EventCategory.IGNORED;
        };
    }

    private boolean isReply(NetworkEvent event) {
        return event.tagValue(EventTags.TURN).isPresent()
                || event.tagValue(EventTags.STATUS).filter(EventTags.STATUS_COMPLETED::equalsIgnoreCase).isPresent();
    }
}
