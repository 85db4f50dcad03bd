package com.dcruver.themerank.pipeline;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;

/**
 * Exclusive claim on a run key while a run is in flight.
 */
@Value
@Builder
@With
public class RunLock {
    RunKey key;
    String token;  // identifies the acquisition; a takeover gets a new one
    PipelineStage stage;
    Instant acquiredAt;
    Instant lastHeartbeat;
    boolean completed;

    /**
     * Non-terminal and silent for longer than the timeout
     */
    public boolean isStale(Instant now, Duration timeout) {
        if (completed || stage.isTerminal()) {
            return false;
        }
        return lastHeartbeat.plus(timeout).isBefore(now);
    }

    public boolean isHeldBy(String candidate) {
        return token.equals(candidate);
    }

    public Duration age(Instant now) {
        return Duration.between(acquiredAt, now);
    }
}
