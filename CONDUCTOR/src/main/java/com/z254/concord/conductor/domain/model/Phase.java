package com.z254.concord.conductor.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Standard workflow phases. Conversations store the phase as a name so that registered
 * custom phases can sit alongside these.
 */
public enum Phase {

    CHAT("Open conversation with the user. Clarify the request and answer directly when no work is needed."),
    BRAINSTORM("Explore options and trade-offs without committing to an approach."),
    PLAN("Produce a concrete, ordered plan with the files, steps and risks involved."),
    EXECUTE("Carry out the agreed plan and report what was changed."),
    VERIFICATION("Check the executed work against the request: run tests, review the diff, confirm behaviour."),
    CHORES("Tidy up after verified work: documentation, inventory updates, follow-up notes."),
    REFLECTION("Record lessons learned from this workflow before handing back to the user.");

    private final String description;

    Phase(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Canonical form of a phase name: trimmed and upper case.
     */
    public static String normalize(String name) {
        return name == null ? null : name.trim().toUpperCase(Locale.ROOT);
    }

    public static Optional<Phase> find(String name) {
        String normalized = normalize(name);
        return Arrays.stream(values())
                .filter(phase -> phase.name().equals(normalized))
                .findFirst();
    }

    public static boolean isStandard(String name) {
        return find(name).isPresent();
    }
}
