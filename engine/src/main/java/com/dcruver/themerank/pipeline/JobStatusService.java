package com.dcruver.themerank.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tracks job progress and repairs statuses orphaned by a dead run.
 *
 * A job stored as IN_PROGRESS whose run lock is missing or stale cannot make
 * progress any more; it is flipped to FAILED lazily when read, and by a
 * periodic sweep.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobStatusService {

    static final String STALLED_MESSAGE = "Processing appears to have stalled";

    private final JobStatusStore store;
    private final RunLockRegistry lockRegistry;

    public JobStatus started(RunKey key) {
        Instant now = lockRegistry.now();
        JobStatus status = JobStatus.builder()
            .owner(key.owner())
            .job(key.job())
            .state(JobState.IN_PROGRESS)
            .stage(PipelineStage.KEYWORD_GENERATION)
            .message("Run started")
            .startedAt(now)
            .updatedAt(now)
            .build();
        store.save(status);
        return status;
    }

    public void stageChanged(RunKey key, PipelineStage stage) {
        store.find(key.owner(), key.job()).ifPresent(status ->
            store.save(status.withStage(stage).withUpdatedAt(lockRegistry.now())));
    }

    public void completed(RunKey key, String message) {
        finish(key, JobState.COMPLETED, PipelineStage.COMPLETED, message);
    }

    public void failed(RunKey key, String message) {
        finish(key, JobState.FAILED, PipelineStage.FAILED, message);
    }

    /**
     * Current status, with stalled runs marked as failed
     */
    public Optional<JobStatus> status(String owner, String job) {
        return store.find(owner, job).map(this::healIfStalled);
    }

    public List<JobStatus> all() {
        return store.findAll();
    }

    /**
     * Mark every stalled in-progress job as failed
     */
    @Scheduled(fixedDelayString = "${themerank.pipeline.sweep-interval-ms:60000}")
    public int sweepStalledJobs() {
        int healed = 0;
        for (JobStatus status : store.findByState(JobState.IN_PROGRESS)) {
            if (healIfStalled(status).getState() == JobState.FAILED) {
                healed++;
            }
        }
        if (healed > 0) {
            log.warn("Marked {} stalled jobs as failed", healed);
        }
        return healed;
    }

    private JobStatus healIfStalled(JobStatus status) {
        if (status.getState() != JobState.IN_PROGRESS) {
            return status;
        }

        boolean lockHeld = lockRegistry.find(status.getOwner(), status.getJob()).isPresent();
        boolean stale = lockRegistry.isStale(status.getOwner(), status.getJob());
        if (lockHeld && !stale) {
            return status;
        }

        log.warn("Job {} is IN_PROGRESS at stage {} but its run lock is {}; marking failed",
            status.key(), status.getStage(), lockHeld ? "stale" : "missing");
        JobStatus healed = status
            .withState(JobState.FAILED)
            .withStage(PipelineStage.FAILED)
            .withMessage(STALLED_MESSAGE)
            .withUpdatedAt(lockRegistry.now());
        store.save(healed);
        return healed;
    }

    private void finish(RunKey key, JobState state, PipelineStage stage, String message) {
        Instant now = lockRegistry.now();
        JobStatus current = store.find(key.owner(), key.job())
            .orElseGet(() -> JobStatus.builder()
                .owner(key.owner())
                .job(key.job())
                .startedAt(now)
                .build());
        store.save(current
            .withState(state)
            .withStage(stage)
            .withMessage(message)
            .withUpdatedAt(now));
    }
}
