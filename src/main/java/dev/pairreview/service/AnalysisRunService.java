package dev.pairreview.service;

import dev.pairreview.config.AnalysisProperties;
import dev.pairreview.domain.entity.AnalysisRun;
import dev.pairreview.domain.enums.RunStatus;
import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.RunInstructions;
import dev.pairreview.domain.valueobject.RunUpdate;
import dev.pairreview.domain.valueobject.VoiceSpec;
import dev.pairreview.exception.ResourceNotFoundException;
import dev.pairreview.repository.AnalysisRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative store of analysis runs and their parent/child hierarchy.
 *
 * <p>Updates lock the row, so only one writer can move a run out of RUNNING and
 * {@code completedAt} is written exactly once.
 */
@Service
public class AnalysisRunService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunService.class);

    private final AnalysisRunRepository repository;
    private final TimeSource time;
    private final Duration watchdogWindow;

    public AnalysisRunService(AnalysisRunRepository repository, TimeSource time, AnalysisProperties properties) {
        this.repository = repository;
        this.time = time;
        this.watchdogWindow = properties.watchdogWindow();
    }

    @Transactional
    public AnalysisRun createSingle(long reviewId, UUID parentRunId, VoiceSpec voice, EnabledLevels levels,
                                    RunInstructions instructions, String headSha) {
        if (parentRunId != null) {
            AnalysisRun parent = require(parentRunId);
            if (parent.getParentRunId() != null)
                throw new IllegalArgumentException("Run %s is a child and cannot have children".formatted(parentRunId));
            if (parent.getReviewId() != reviewId)
                throw new IllegalArgumentException("Child run must belong to review " + parent.getReviewId());
        }
        AnalysisRun run = AnalysisRun.createSingle(reviewId, parentRunId, voice, levels,
                instructions.repoInstructions(), instructions.requestInstructions(), headSha, time.now());
        log.debug("Created run {} for review {} ({})", run.getId(), reviewId, voice.key());
        return repository.save(run);
    }

    @Transactional
    public AnalysisRun createCouncilParent(long reviewId, EnabledLevels levels, RunInstructions instructions,
                                           String headSha) {
        AnalysisRun run = AnalysisRun.createCouncilParent(reviewId, levels,
                instructions.repoInstructions(), instructions.requestInstructions(), headSha, time.now());
        log.debug("Created council run {} for review {}", run.getId(), reviewId);
        return repository.save(run);
    }

    /**
     * Applies {@code update} to a RUNNING run.
     *
     * @return false when the run had already reached a terminal state; the row is left untouched
     */
    @Transactional
    public boolean update(UUID runId, RunUpdate update) {
        AnalysisRun run = repository.findByIdForUpdate(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Analysis run", runId));
        boolean applied = run.apply(update, time.now());
        if (!applied) {
            log.debug("Ignoring update {} for run {} already {}", update.status(), runId, run.getStatus());
        }
        return applied;
    }

    /**
     * Persists CANCELLED for a run and every child still running.
     *
     * @return false when the run itself had already reached a terminal state
     */
    @Transactional
    public boolean cancelWithChildren(UUID runId) {
        boolean applied = update(runId, RunUpdate.cancelled());
        for (AnalysisRun child : repository.findByParentRunIdOrderByStartedAtAsc(runId)) {
            if (child.getStatus() == RunStatus.RUNNING) {
                update(child.getId(), RunUpdate.cancelled());
            }
        }
        return applied;
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisRun> getById(UUID runId) {
        return repository.findById(runId);
    }

    @Transactional(readOnly = true)
    public AnalysisRun require(UUID runId) {
        return repository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Analysis run", runId));
    }

    /** All runs of a review in display order. */
    @Transactional(readOnly = true)
    public List<AnalysisRun> getByReviewId(long reviewId) {
        return repository.findByReviewIdInDisplayOrder(reviewId);
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisRun> getLatestByReviewId(long reviewId) {
        return repository.findByReviewIdInDisplayOrder(reviewId, PageRequest.of(0, 1)).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<AnalysisRun> getChildRuns(UUID parentRunId) {
        return repository.findByParentRunIdOrderByStartedAtAsc(parentRunId);
    }

    @Transactional
    public int deleteByReviewId(long reviewId) {
        int deleted = repository.deleteByReviewId(reviewId);
        log.info("Deleted {} analysis runs of review {}", deleted, reviewId);
        return deleted;
    }

    /**
     * Fails RUNNING runs older than the watchdog window. Age-based so a run owned by another
     * process sharing the store is left alone while it is still plausibly alive.
     */
    @Transactional
    public int failStuckRuns() {
        Instant now = time.now();
        Instant cutoff = now.minus(watchdogWindow);
        return repository.failRunsStartedBefore(cutoff, now,
                "Analysis did not finish within " + watchdogWindow.toMinutes() + " minutes",
                RunStatus.RUNNING, RunStatus.FAILED);
    }
}
