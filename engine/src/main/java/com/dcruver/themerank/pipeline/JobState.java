package com.dcruver.themerank.pipeline;

/**
 * Persisted lifecycle of a job.
 */
public enum JobState {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
