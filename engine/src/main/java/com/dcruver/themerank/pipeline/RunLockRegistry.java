package com.dcruver.themerank.pipeline;

import com.dcruver.themerank.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory table of run locks, at most one per (owner, job).
 *
 * Acquisition is a single {@link ConcurrentHashMap#compute} so the
 * check-and-set is atomic. A lock whose holder stopped heartbeating for longer
 * than the stale timeout is taken over by the next acquirer. Every acquisition
 * carries its own token, so a holder that lost its lock to a takeover cannot
 * move, refresh or release the new holder's lock.
 */
@Component
@Slf4j
public class RunLockRegistry {

    private final Map<RunKey, RunLock> locks = new ConcurrentHashMap<>();
    private final Map<RunKey, Boolean> lastResults = new ConcurrentHashMap<>();
    private final Duration staleTimeout;
    private final Clock clock;

    @Autowired
    public RunLockRegistry(PipelineProperties properties) {
        this(properties.getStaleTimeout(), Clock.systemUTC());
    }

    public RunLockRegistry(Duration staleTimeout, Clock clock) {
        this.staleTimeout = staleTimeout;
        this.clock = clock;
    }

    /**
     * Claim the key. Empty when a live lock already holds it; otherwise the
     * token that later stage updates, heartbeats and the release must present.
     */
    public Optional<String> acquire(String owner, String job) {
        RunKey key = new RunKey(owner, job);
        Instant now = clock.instant();
        String token = UUID.randomUUID().toString();
        boolean[] acquired = {false};

        locks.compute(key, (k, existing) -> {
            if (existing != null && !existing.isStale(now, staleTimeout)) {
                return existing;
            }
            if (existing != null) {
                log.warn("Replacing stale lock for {} (stage {}, last heartbeat {})",
                    k, existing.getStage(), existing.getLastHeartbeat());
            }
            acquired[0] = true;
            return RunLock.builder()
                .key(k)
                .token(token)
                .stage(PipelineStage.KEYWORD_GENERATION)
                .acquiredAt(now)
                .lastHeartbeat(now)
                .completed(false)
                .build();
        });

        if (!acquired[0]) {
            return Optional.empty();
        }
        log.info("Acquired run lock for {}", key);
        return Optional.of(token);
    }

    /**
     * Record the stage the run has reached and refresh the heartbeat. False
     * when the lock is gone or now belongs to a later acquisition.
     */
    public boolean updateStage(String owner, String job, String token, PipelineStage stage) {
        Instant now = clock.instant();
        RunLock updated = updateHeld(new RunKey(owner, job), token,
            lock -> lock.withStage(stage).withLastHeartbeat(now));
        if (updated == null) {
            log.warn("Run {}/{} does not hold its lock while moving to {}", owner, job, stage);
            return false;
        }
        log.info("Run {} entered stage {}", updated.getKey(), stage);
        return true;
    }

    public boolean heartbeat(String owner, String job, String token) {
        Instant now = clock.instant();
        return updateHeld(new RunKey(owner, job), token, lock -> lock.withLastHeartbeat(now)) != null;
    }

    /**
     * Drop the lock and remember whether the run succeeded. A holder whose
     * lock was taken over releases nothing.
     */
    public boolean release(String owner, String job, String token, boolean completed) {
        RunKey key = new RunKey(owner, job);
        RunLock[] removed = {null};
        locks.computeIfPresent(key, (k, lock) -> {
            if (!lock.isHeldBy(token)) {
                return lock;
            }
            removed[0] = lock;
            return null;
        });

        if (removed[0] == null) {
            log.warn("Released {} but its lock was not held by this run", key);
            return false;
        }
        lastResults.put(key, completed);
        log.info("Released run lock for {} ({}, held {}s)",
            key, completed ? "completed" : "failed", removed[0].age(clock.instant()).toSeconds());
        return true;
    }

    private RunLock updateHeld(RunKey key, String token, UnaryOperator<RunLock> change) {
        RunLock[] updated = {null};
        locks.computeIfPresent(key, (k, lock) -> {
            if (!lock.isHeldBy(token)) {
                return lock;
            }
            updated[0] = change.apply(lock);
            return updated[0];
        });
        return updated[0];
    }

    public Optional<PipelineStage> currentStage(String owner, String job) {
        return find(owner, job).map(RunLock::getStage);
    }

    /**
     * True while a live, non-terminal lock exists
     */
    public boolean isRunning(String owner, String job) {
        Instant now = clock.instant();
        return find(owner, job)
            .filter(lock -> !lock.getStage().isTerminal() && !lock.isCompleted())
            .filter(lock -> !lock.isStale(now, staleTimeout))
            .isPresent();
    }

    public boolean isStale(String owner, String job) {
        Instant now = clock.instant();
        return find(owner, job).map(lock -> lock.isStale(now, staleTimeout)).orElse(false);
    }

    public Optional<RunLock> find(String owner, String job) {
        return Optional.ofNullable(locks.get(new RunKey(owner, job)));
    }

    /**
     * Outcome of the last released run for the key, if any
     */
    public Optional<Boolean> lastResult(String owner, String job) {
        return Optional.ofNullable(lastResults.get(new RunKey(owner, job)));
    }

    /**
     * Currently held locks, oldest first
     */
    public List<RunLock> activeRuns() {
        return locks.values().stream()
            .sorted(Comparator.comparing(RunLock::getAcquiredAt))
            .toList();
    }

    public Instant now() {
        return clock.instant();
    }
}
