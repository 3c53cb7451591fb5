package com.z254.concord.conductor.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of one routing cycle: who acts next, in which phase, and why.
 */
@Value
@Builder
@Jacksonized
public class RoutingDecision {

    public static final String END = "END";

    List<String> agents;

    /**
     * Target phase, null to stay in the current one.
     */
    String phase;

    String reason;

    @JsonIgnore
    public boolean isEnd() {
        return agents != null && agents.size() == 1 && END.equals(agents.get(0));
    }

    public static RoutingDecision end(String reason) {
        return RoutingDecision.builder().agents(List.of(END)).reason(reason).build();
    }
}
