package com.z254.concord.conductor.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Accumulated time the conversation spent with a routing turn open.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionTime {

    private long totalSeconds;
    private boolean active;
    private Instant activeSince;

    public void start(Instant now) {
        if (!active) {
            active = true;
            activeSince = now;
        }
    }

    public void stop(Instant now) {
        if (active && activeSince != null) {
            totalSeconds += Math.max(0, Duration.between(activeSince, now).getSeconds());
        }
        active = false;
        activeSince = null;
    }

    /**
     * Total including the running interval, if any.
     */
    @JsonIgnore
    public long elapsedSeconds(Instant now) {
        if (active && activeSince != null) {
            return totalSeconds + Math.max(0, Duration.between(activeSince, now).getSeconds());
        }
        return totalSeconds;
    }
}
