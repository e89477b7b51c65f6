package dev.pairreview.analysis.progress;

import dev.pairreview.config.AnalysisProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs executing in this process, keyed by run id.
 *
 * <p>Entries are inserted on start and stay queryable for the retention window after they finish;
 * {@link #pruneExpired()} then removes them and closes their progress streams.
 */
@Component
public class ActiveRunRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActiveRunRegistry.class);

    private final Map<UUID, ActiveRun> runs = new ConcurrentHashMap<>();
    private final Map<Long, UUID> runningByReview = new ConcurrentHashMap<>();
    private final ProgressBroadcaster broadcaster;
    private final Clock clock;
    private final Duration retention;

    public ActiveRunRegistry(ProgressBroadcaster broadcaster, Clock clock, AnalysisProperties properties) {
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.retention = properties.progressRetention();
    }

    /**
     * Tracks a new run.
     *
     * @throws IllegalStateException when another run of the same review is still executing here
     */
    public ActiveRun register(UUID runId, long reviewId) {
        ActiveRun run = new ActiveRun(runId, reviewId, broadcaster::publish, clock);
        runningByReview.compute(reviewId, (id, current) -> {
            if (current != null && findUnfinished(current).isPresent())
                throw new IllegalStateException("Analysis %s is already running for review %d".formatted(current, id));
            return runId;
        });
        runs.put(runId, run);
        broadcaster.open(runId);
        broadcaster.publish(run.snapshot());
        return run;
    }

    public Optional<ActiveRun> get(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /** The run currently executing for a review in this process, if any. */
    public Optional<ActiveRun> findRunningByReview(long reviewId) {
        UUID runId = runningByReview.get(reviewId);
        return runId == null ? Optional.empty() : findUnfinished(runId);
    }

    /** Called once the run is terminal; the entry is kept until the retention window passes. */
    public void markFinished(ActiveRun run) {
        runningByReview.remove(run.getReviewId(), run.getRunId());
    }

    @Scheduled(fixedDelayString = "${pairreview.analysis.prune-interval:PT30S}")
    public void pruneExpired() {
        Instant cutoff = clock.instant().minus(retention);
        runs.values().removeIf(run -> {
            Instant finishedAt = run.getFinishedAt();
            if (finishedAt == null || finishedAt.isAfter(cutoff)) return false;
            runningByReview.remove(run.getReviewId(), run.getRunId());
            broadcaster.close(run.getRunId());
            log.debug("Dropped progress of run {}", run.getRunId());
            return true;
        });
    }

    private Optional<ActiveRun> findUnfinished(UUID runId) {
        return get(runId).filter(run -> !run.isFinished());
    }

    public int size() {
        return runs.size();
    }
}
