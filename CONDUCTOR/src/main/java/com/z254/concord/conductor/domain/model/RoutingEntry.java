package com.z254.concord.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A routing turn: the agents targeted by one decision and the replies collected so far.
 * Completed once every target agent has replied, or when closed by force.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingEntry {

    private String turnId;
    private Instant createdAt;
    private String phase;

    /**
     * Target agent slugs, in decision order.
     */
    private List<String> agents;

    /**
     * Replies in arrival order.
     */
    @Builder.Default
    private List<Completion> completions = new ArrayList<>();

    private String reason;
    private String initiator;
    private boolean completed;
    private boolean forceClosed;
    private String closeReason;
    private Instant closedAt;

    public boolean targets(String agent) {
        return agents != null && agents.contains(agent);
    }

    public boolean hasReplyFrom(String agent) {
        return completions != null && completions.stream()
                .anyMatch(completion -> completion.getAgent().equals(agent));
    }

    /**
     * Target agents that have not replied yet, in decision order.
     */
    public List<String> pendingAgents() {
        if (agents == null) {
            return List.of();
        }
        Set<String> replied = repliedAgents();
        return agents.stream()
                .filter(agent -> !replied.contains(agent))
                .toList();
    }

    public boolean coverageReached() {
        return agents != null && !agents.isEmpty() && repliedAgents().containsAll(agents);
    }

    public void addCompletion(Completion completion) {
        if (completions == null) {
            completions = new ArrayList<>();
        }
        completions.add(completion);
    }

    private Set<String> repliedAgents() {
        if (completions == null) {
            return Set.of();
        }
        return completions.stream()
                .map(Completion::getAgent)
                .collect(Collectors.toSet());
    }
}
