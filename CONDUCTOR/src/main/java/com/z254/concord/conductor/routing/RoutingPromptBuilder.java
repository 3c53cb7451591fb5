package com.z254.concord.conductor.routing;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.domain.model.AgentCapability;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.SpecialistAgent;
import com.z254.concord.conductor.phase.PhaseStateMachine;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the fixed system instructions for routing and diagnostic requests.
 */
@Component
public class RoutingPromptBuilder {

    private static final String DECISION_FORMAT = """
            Respond with a single JSON object and nothing else:
            {"agents": ["<agent-slug>", ...], "phase": "<optional next phase>", "reason": "<why>"}

            Rules:
            - "agents" lists who acts next. Several agents work in parallel on the same request.
            - Use ["END"] alone when the user's request has been fully handled.
            - Omit "phase" to stay in the current phase. A phase change must be one of the valid
              next phases listed above.
            - "reason" is required and is shown to the agents you select.
            """;

    private final AgentRegistry registry;
    private final PhaseStateMachine phaseStateMachine;

    public RoutingPromptBuilder(AgentRegistry registry, PhaseStateMachine phaseStateMachine) {
        this.registry = registry;
        this.phaseStateMachine = phaseStateMachine;
    }

    public String routingInstructions(Conversation conversation) {
        return context(conversation) + "\n" + DECISION_FORMAT;
    }

    public String diagnosticInstructions(Conversation conversation) {
        return context(conversation)
                + "\nAnswer the operator's question about this conversation in plain text."
                + " Refer to turns by phase and agents.";
    }

    private String context(Conversation conversation) {
        StringBuilder prompt = new StringBuilder()
                .append("You are the orchestrator of a team of agents. You decide who works next")
                .append(" on the user's request; you never do the work yourself.\n\n")
                .append("Available agents:\n");
        for (SpecialistAgent agent : registry.specialists()) {
            prompt.append("- ").append(agent.getSlug());
            if (StringUtils.hasText(agent.getRole())) {
                prompt.append(": ").append(agent.getRole());
            }
            if (!agent.getCapabilities().isEmpty()) {
                prompt.append(" [").append(capabilities(agent)).append(']');
            }
            prompt.append('\n');
        }

        String phase = conversation.getPhase();
        prompt.append("\nCurrent phase: ").append(phase);
        String instructions = phaseStateMachine.phaseInstructions(conversation, phase);
        if (StringUtils.hasText(instructions)) {
            prompt.append(" (").append(instructions).append(')');
        }
        List<String> next = phaseStateMachine.validTransitions(conversation);
        prompt.append("\nValid next phases: ").append(String.join(", ", next)).append('\n');
        return prompt.toString();
    }

    private String capabilities(SpecialistAgent agent) {
        return agent.getCapabilities().stream()
                .map(AgentCapability::name)
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
