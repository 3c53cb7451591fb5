package com.z254.concord.conductor.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One entry of the append-only phase transition log.
 */
@Value
@Builder
@Jacksonized
public class PhaseTransition {
    String from;
    String to;
    String initiatingAgent;
    String reason;
    String instructions;
    Instant timestamp;
}
