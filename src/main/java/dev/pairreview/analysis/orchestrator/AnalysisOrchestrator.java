package dev.pairreview.analysis.orchestrator;

import dev.pairreview.analysis.AnalysisInput;
import dev.pairreview.analysis.council.CouncilConfig;
import dev.pairreview.analysis.council.CouncilConfigValidator;
import dev.pairreview.analysis.council.CouncilCoordinator;
import dev.pairreview.analysis.council.CouncilPlan;
import dev.pairreview.analysis.pipeline.LevelPipeline;
import dev.pairreview.analysis.pipeline.PipelineOutcome;
import dev.pairreview.analysis.pipeline.PipelineRequest;
import dev.pairreview.analysis.progress.ActiveRun;
import dev.pairreview.analysis.progress.ActiveRunRegistry;
import dev.pairreview.config.VoiceProperties;
import dev.pairreview.domain.entity.AnalysisRun;
import dev.pairreview.domain.enums.ConfigType;
import dev.pairreview.domain.enums.RunStatus;
import dev.pairreview.domain.enums.VoiceTier;
import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.RunUpdate;
import dev.pairreview.domain.valueobject.VoiceSpec;
import dev.pairreview.dto.request.AnalysisRequest;
import dev.pairreview.dto.response.AnalysisRunResponse;
import dev.pairreview.dto.response.AnalysisStartedResponse;
import dev.pairreview.dto.response.AnalysisStatusResponse;
import dev.pairreview.dto.response.CancelResponse;
import dev.pairreview.service.AnalysisRunService;
import dev.pairreview.service.ReviewService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Entry point for analyses.
 *
 * <pre>
 *  1. Validate the request and load the review's input (snapshot, checkout, instructions)
 *  2. Create the run row (RUNNING) and register it for progress and cancellation
 *  3. Execute on the analysis executor: one LevelPipeline, or a council of them
 *  4. Record the outcome on the run row, unless a cancel already made it terminal
 *  5. Finish the in-memory run so subscribers see the terminal snapshot
 * </pre>
 *
 * <p>Not transactional as a whole: each step that touches the store goes through a service method
 * with its own transaction, so worker threads never hold managed entities.
 */
@Component
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);
    static final String MDC_RUN_ID = "runId";

    private final LevelPipeline pipeline;
    private final CouncilCoordinator councilCoordinator;
    private final AnalysisRunService runService;
    private final ReviewService reviewService;
    private final ActiveRunRegistry registry;
    private final VoiceProperties voiceProperties;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    public AnalysisOrchestrator(LevelPipeline pipeline,
                                CouncilCoordinator councilCoordinator,
                                AnalysisRunService runService,
                                ReviewService reviewService,
                                ActiveRunRegistry registry,
                                VoiceProperties voiceProperties,
                                @Qualifier("analysisExecutorService") ExecutorService executor,
                                MeterRegistry meterRegistry) {
        this.pipeline = pipeline;
        this.councilCoordinator = councilCoordinator;
        this.runService = runService;
        this.reviewService = reviewService;
        this.registry = registry;
        this.voiceProperties = voiceProperties;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public AnalysisStartedResponse startSingle(long reviewId, AnalysisRequest request) {
        VoiceSpec voice = resolveVoice(request);
        EnabledLevels levels = request.enabledLevels();
        if (!levels.anyEnabled())
            throw new IllegalArgumentException("At least one level (1, 2, or 3) must be enabled");
        requireNoActiveRun(reviewId);

        AnalysisInput input = reviewService.loadAnalysisInput(reviewId, request.instructions());
        AnalysisRun run = runService.createSingle(reviewId, null, voice, levels, input.instructions(),
                input.headSha());
        ActiveRun active = register(run);
        log.info("Starting analysis {} of review {} with {} (levels {})", run.getId(), reviewId, voice.key(),
                levels.enabled());

        submit(active, ConfigType.SINGLE, input, () -> pipeline.run(
                PipelineRequest.single(run.getId(), input, voice, levels), active.sink(), active.getToken()));
        return new AnalysisStartedResponse(run.getId(), reviewId, RunStatus.RUNNING, 1);
    }

    public AnalysisStartedResponse startCouncil(long reviewId, CouncilConfig config, String instructions) {
        CouncilPlan plan = CouncilConfigValidator.toPlan(config);
        requireNoActiveRun(reviewId);

        AnalysisInput input = reviewService.loadAnalysisInput(reviewId, instructions);
        AnalysisRun parent = runService.createCouncilParent(reviewId, plan.parentLevels(), input.instructions(),
                input.headSha());
        ActiveRun active = register(parent);
        log.info("Starting council {} of review {} with {} voices", parent.getId(), reviewId, plan.voices().size());

        submit(active, ConfigType.COUNCIL, input,
                () -> councilCoordinator.run(parent.getId(), input, plan, active));
        return new AnalysisStartedResponse(parent.getId(), reviewId, RunStatus.RUNNING, plan.voices().size());
    }

    /** Live progress when this process tracks the run, plus the stored row. */
    public AnalysisStatusResponse getStatus(UUID runId) {
        AnalysisRun run = runService.require(runId);
        return new AnalysisStatusResponse(AnalysisRunResponse.from(run),
                registry.get(runId).map(ActiveRun::snapshot).orElse(null));
    }

    /**
     * Cancels a run. Idempotent: a run that is already terminal is acknowledged with its stored status.
     * The store transition comes first and the in-memory run follows it, so the acknowledgement, the
     * progress stream and the row always agree. A RUNNING row no longer tracked in memory (its process
     * is gone) is cancelled in the store only.
     *
     * @throws IllegalStateException for a council voice that is still running; only its council can
     *                               be cancelled
     */
    public CancelResponse cancel(UUID runId) {
        var active = registry.get(runId);
        if (active.isPresent()) {
            ActiveRun run = active.get();
            if (run.isFinished()) {
                return new CancelResponse(runId, run.getStatus(), false);
            }
            if (!runService.cancelWithChildren(runId)) {
                RunStatus stored = runService.require(runId).getStatus();
                log.info("Run {} reached {} before the cancel was stored", runId, stored);
                return new CancelResponse(runId, stored, false);
            }
            run.cancel();
            log.info("Cancelled run {}", runId);
            return new CancelResponse(runId, RunStatus.CANCELLED, true);
        }

        AnalysisRun stored = runService.require(runId);
        if (stored.getStatus().isTerminal()) {
            return new CancelResponse(runId, stored.getStatus(), false);
        }
        if (stored.getParentRunId() != null) {
            throw new IllegalStateException("Run %s is a council voice; cancel council %s instead"
                    .formatted(runId, stored.getParentRunId()));
        }
        boolean applied = runService.cancelWithChildren(runId);
        log.info("Cancelled untracked run {} in the store", runId);
        return new CancelResponse(runId, applied ? RunStatus.CANCELLED : runService.require(runId).getStatus(),
                applied);
    }

    // ── Internal ───────────────────────────────────────────────────

    private VoiceSpec resolveVoice(AnalysisRequest request) {
        String provider = blankToNull(request.provider());
        String model = blankToNull(request.model());
        return new VoiceSpec(
                provider != null ? provider : voiceProperties.defaultProvider(),
                model != null ? model : voiceProperties.defaultModel(),
                VoiceTier.parse(request.tier(), voiceProperties.defaultTier()));
    }

    private void requireNoActiveRun(long reviewId) {
        registry.findRunningByReview(reviewId).ifPresent(run -> {
            throw new IllegalStateException(
                    "Analysis %s is already running for review %d".formatted(run.getRunId(), reviewId));
        });
    }

    private ActiveRun register(AnalysisRun run) {
        try {
            return registry.register(run.getId(), run.getReviewId());
        } catch (IllegalStateException e) {
            runService.update(run.getId(), RunUpdate.failed(e.getMessage()));
            throw e;
        }
    }

    private void submit(ActiveRun active, ConfigType type, AnalysisInput input, Supplier<PipelineOutcome> work) {
        try {
            executor.execute(() -> execute(active, type, input, work));
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule analysis {}: {}", active.getRunId(), e.getMessage());
            finish(active, PipelineOutcome.failed("Analysis could not be scheduled: " + e.getMessage()));
            throw e;
        }
    }

    private void execute(ActiveRun active, ConfigType type, AnalysisInput input, Supplier<PipelineOutcome> work) {
        MDC.put(MDC_RUN_ID, active.getRunId().toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        PipelineOutcome outcome;
        try {
            runService.update(active.getRunId(), RunUpdate.progress(input.changedFiles().size()));
            outcome = work.get();
        } catch (RuntimeException e) {
            log.error("Analysis {} failed: {}", active.getRunId(), e.getMessage(), e);
            outcome = PipelineOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        try {
            finish(active, outcome);
        } finally {
            sample.stop(Timer.builder("pairreview.analysis.duration")
                    .description("End-to-end analysis time")
                    .tag("type", type.name().toLowerCase(Locale.ROOT))
                    .tag("outcome", outcome.kind().name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
            MDC.remove(MDC_RUN_ID);
        }
    }

    /**
     * Records the outcome. The store update is a no-op for a run a cancel already made terminal,
     * so a cancelled run is never overwritten with FAILED or COMPLETED; the in-memory run then
     * takes the stored status instead of the outcome.
     */
    private void finish(ActiveRun active, PipelineOutcome outcome) {
        UUID runId = active.getRunId();
        RunStatus terminal = outcome.toRunUpdate().status();
        String message = switch (outcome.kind()) {
            case COMPLETED -> "Analysis complete: %d suggestions".formatted(outcome.suggestions().size());
            case FAILED -> outcome.failureReason();
            case CANCELLED -> "Analysis cancelled";
        };
        try {
            boolean applied = runService.update(runId, outcome.toRunUpdate());
            if (applied && outcome.isCompleted()) {
                reviewService.updateSummary(active.getReviewId(), outcome.summary());
            } else if (!applied) {
                terminal = runService.require(runId).getStatus();
                message = "Analysis " + terminal.name().toLowerCase(Locale.ROOT);
            }
        } catch (RuntimeException e) {
            log.error("Could not record outcome of run {}: {}", runId, e.getMessage(), e);
        }

        active.finish(terminal, message);
        registry.markFinished(active);
        log.info("Analysis {} finished: {}", runId, active.getStatus());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
