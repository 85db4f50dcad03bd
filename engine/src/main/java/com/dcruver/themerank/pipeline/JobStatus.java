package com.dcruver.themerank.pipeline;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Last known state of a job, as stored in the database.
 */
@Value
@Builder
@With
public class JobStatus {
    String owner;
    String job;
    JobState state;
    PipelineStage stage;
    String message;
    Instant startedAt;
    Instant updatedAt;

    public RunKey key() {
        return new RunKey(owner, job);
    }
}
