package com.z254.concord.conductor.phase;

import com.z254.concord.conductor.domain.model.Phase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.z254.concord.conductor.domain.model.Phase.BRAINSTORM;
import static com.z254.concord.conductor.domain.model.Phase.CHAT;
import static com.z254.concord.conductor.domain.model.Phase.CHORES;
import static com.z254.concord.conductor.domain.model.Phase.EXECUTE;
import static com.z254.concord.conductor.domain.model.Phase.PLAN;
import static com.z254.concord.conductor.domain.model.Phase.REFLECTION;
import static com.z254.concord.conductor.domain.model.Phase.VERIFICATION;

/**
 * Allowed phase transitions. Every standard phase may hand off to itself.
 *
 * <p>Custom phases sit outside the table: entering one needs instructions unless it was
 * registered earlier, and a custom phase may move to any standard or registered phase.
 */
@Component
public class PhaseTransitionGraph {

    private final Map<Phase, Set<Phase>> edges = new EnumMap<>(Phase.class);

    public PhaseTransitionGraph() {
        edges.put(CHAT, EnumSet.of(CHAT, BRAINSTORM, PLAN, EXECUTE, REFLECTION));
        edges.put(BRAINSTORM, EnumSet.of(BRAINSTORM, CHAT, PLAN, REFLECTION));
        edges.put(PLAN, EnumSet.of(PLAN, CHAT, EXECUTE, REFLECTION));
        edges.put(EXECUTE, EnumSet.of(EXECUTE, CHAT, PLAN, VERIFICATION, REFLECTION));
        edges.put(VERIFICATION, EnumSet.of(VERIFICATION, CHAT, EXECUTE, CHORES, REFLECTION));
        edges.put(CHORES, EnumSet.of(CHORES, CHAT, REFLECTION));
        edges.put(REFLECTION, EnumSet.of(REFLECTION, CHAT, PLAN, EXECUTE));
    }

    public Set<Phase> targets(Phase from) {
        return Collections.unmodifiableSet(edges.get(from));
    }

    /**
     * @param from                 current phase (normalized)
     * @param to                   requested phase (normalized)
     * @param registeredCustom     custom phases already registered on the conversation
     * @param instructionsProvided whether the request carries instructions for the target
     */
    public boolean isAllowed(String from, String to, Map<String, String> registeredCustom,
                             boolean instructionsProvided) {
        boolean targetStandard = Phase.isStandard(to);
        boolean targetKnownCustom = registeredCustom != null && registeredCustom.containsKey(to);
        if (!targetStandard && !targetKnownCustom && !instructionsProvided) {
            return false;
        }
        if (from.equals(to)) {
            return true;
        }
        return Phase.find(from)
                .map(standardFrom -> !targetStandard || edges.get(standardFrom).contains(Phase.valueOf(to)))
                .orElse(true);
    }

    /**
     * Phases reachable from {@code from} without supplying new instructions.
     */
    public List<String> validTransitions(String from, Map<String, String> registeredCustom) {
        List<String> result = new ArrayList<>();
        Phase.find(from).ifPresentOrElse(
                standard -> edges.get(standard).forEach(phase -> result.add(phase.name())),
                () -> {
                    for (Phase phase : Phase.values()) {
                        result.add(phase.name());
                    }
                    result.add(from);
                });
        if (registeredCustom != null) {
            registeredCustom.keySet().stream()
                    .filter(custom -> !result.contains(custom))
                    .forEach(result::add);
        }
        return result;
    }
}
