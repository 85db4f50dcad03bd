package com.dcruver.themerank.pipeline;

/**
 * Identifies a run: who asked for it and which job it belongs to.
 */
public record RunKey(String owner, String job) {

    public RunKey {
        if (owner == null || owner.isBlank() || job == null || job.isBlank()) {
            throw new IllegalArgumentException("Run key needs a non-blank owner and job");
        }
    }

    @Override
    public String toString() {
        return owner + "/" + job;
    }
}
