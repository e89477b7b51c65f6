package dev.pairreview.analysis.progress;

import dev.pairreview.domain.enums.LevelState;
import dev.pairreview.domain.enums.RunStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * In-memory state of a run executing in this process: its progress and its cancellation token.
 *
 * <p>Every mutation publishes a fresh snapshot while holding the lock, so subscribers observe
 * snapshots in mutation order. Once the run is terminal, level updates are ignored.
 */
public class ActiveRun {

    private static final String[] LEVEL_KEYS = {"1", "2", "3", ProgressSink.FINAL};

    private final UUID runId;
    private final long reviewId;
    private final CancellationToken token = new CancellationToken();
    private final Consumer<ProgressStatus> publisher;
    private final Clock clock;

    private final Map<String, LevelProgress> levels = initialLevels();
    private final Map<String, Map<String, LevelProgress>> voices = new LinkedHashMap<>();
    private RunStatus status = RunStatus.RUNNING;
    private String message = "Starting analysis";
    private Instant finishedAt;

    public ActiveRun(UUID runId, long reviewId, Consumer<ProgressStatus> publisher, Clock clock) {
        this.runId = runId;
        this.reviewId = reviewId;
        this.publisher = publisher;
        this.clock = clock;
    }

    /** Sink for the run's own levels. */
    public ProgressSink sink() {
        return (levelKey, state, msg) -> updateLevel(levels, levelKey, state, msg);
    }

    /** Sink for one council voice; registers the voice with all levels pending. */
    public ProgressSink voiceSink(String voiceId) {
        Map<String, LevelProgress> voiceLevels;
        synchronized (this) {
            voiceLevels = voices.computeIfAbsent(voiceId, id -> initialLevels());
            publish();
        }
        return (levelKey, state, msg) -> updateLevel(voiceLevels, levelKey, state, msg);
    }

    /**
     * Moves the run to a terminal state.
     *
     * @return false if the run was already terminal (for example cancelled)
     */
    public synchronized boolean finish(RunStatus terminal, String finalMessage) {
        if (!terminal.isTerminal())
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        if (status.isTerminal()) return false;
        this.status = terminal;
        this.message = finalMessage;
        this.finishedAt = clock.instant();
        publish();
        return true;
    }

    /**
     * Flips the run to CANCELLED immediately, marks unfinished levels cancelled and signals the token.
     *
     * @return false if the run had already reached a terminal state
     */
    public synchronized boolean cancel() {
        if (status.isTerminal()) return false;
        token.cancel();
        this.status = RunStatus.CANCELLED;
        this.message = "Analysis cancelled";
        this.finishedAt = clock.instant();
        cancelUnsettled(levels);
        voices.values().forEach(ActiveRun::cancelUnsettled);
        publish();
        return true;
    }

    public synchronized ProgressStatus snapshot() {
        Map<String, Map<String, LevelProgress>> voiceCopy = new LinkedHashMap<>();
        voices.forEach((id, lv) -> voiceCopy.put(id, Map.copyOf(lv)));
        return new ProgressStatus(runId, reviewId, status, message, copyOrdered(levels), voiceCopy, clock.instant());
    }

    public UUID getRunId() {
        return runId;
    }

    public long getReviewId() {
        return reviewId;
    }

    public CancellationToken getToken() {
        return token;
    }

    public synchronized RunStatus getStatus() {
        return status;
    }

    public synchronized boolean isFinished() {
        return status.isTerminal();
    }

    /** When the run became terminal, or null while it is running. */
    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    // ── Internal ───────────────────────────────────────────────────

    private synchronized void updateLevel(Map<String, LevelProgress> target, String levelKey,
                                          LevelState state, String msg) {
        if (status.isTerminal()) return;
        target.put(levelKey, new LevelProgress(state, msg));
        if (msg != null) this.message = msg;
        publish();
    }

    private void publish() {
        publisher.accept(snapshot());
    }

    private static void cancelUnsettled(Map<String, LevelProgress> target) {
        target.replaceAll((key, progress) -> progress.state().isSettled()
                ? progress
                : new LevelProgress(LevelState.CANCELLED, "Cancelled"));
    }

    private static Map<String, LevelProgress> initialLevels() {
        Map<String, LevelProgress> map = new LinkedHashMap<>();
        for (String key : LEVEL_KEYS) {
            map.put(key, LevelProgress.pending());
        }
        return map;
    }

    private static Map<String, LevelProgress> copyOrdered(Map<String, LevelProgress> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
