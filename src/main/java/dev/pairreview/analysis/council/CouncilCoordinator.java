package dev.pairreview.analysis.council;

import dev.pairreview.analysis.AnalysisInput;
import dev.pairreview.analysis.council.CouncilPlan.VoicePlan;
import dev.pairreview.analysis.pipeline.LevelPipeline;
import dev.pairreview.analysis.pipeline.PipelineOutcome;
import dev.pairreview.analysis.pipeline.PipelineRequest;
import dev.pairreview.analysis.pipeline.SuggestionMerger;
import dev.pairreview.analysis.progress.ActiveRun;
import dev.pairreview.analysis.progress.ProgressSink;
import dev.pairreview.analysis.prompt.PromptBuilder;
import dev.pairreview.analysis.prompt.PromptType;
import dev.pairreview.analysis.voice.VoiceInvocationException;
import dev.pairreview.analysis.voice.VoiceRequest;
import dev.pairreview.analysis.voice.VoiceResponse;
import dev.pairreview.analysis.voice.VoiceRunner;
import dev.pairreview.domain.enums.LevelState;
import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.SuggestionDraft;
import dev.pairreview.domain.valueobject.VoiceSpec;
import dev.pairreview.service.AnalysisRunService;
import dev.pairreview.service.SuggestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs a council: one {@link LevelPipeline} per voice under its own child run, then one
 * consolidation over the survivors.
 *
 * <pre>
 *              ┌─► child 0 (voice A, levels…) ──┐
 *  parent ─────┼─► child 1 (voice B, levels…) ──┼──► consolidation voice ──► parent final set
 *              └─► child 2 (voice C, levels…) ──┘
 * </pre>
 *
 * <p>Children run concurrently and write raw suggestions only. Each child's run row reaches its
 * terminal state before the parent's outcome is returned, so the parent always completes last.
 * One failed voice does not fail the council; all of them failing does.
 */
@Component
public class CouncilCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CouncilCoordinator.class);

    private final LevelPipeline pipeline;
    private final VoiceRunner voiceRunner;
    private final AnalysisRunService runService;
    private final SuggestionService suggestionService;
    private final ExecutorService executor;

    public CouncilCoordinator(LevelPipeline pipeline,
                              VoiceRunner voiceRunner,
                              AnalysisRunService runService,
                              SuggestionService suggestionService,
                              @Qualifier("analysisExecutorService") ExecutorService executor) {
        this.pipeline = pipeline;
        this.voiceRunner = voiceRunner;
        this.runService = runService;
        this.suggestionService = suggestionService;
        this.executor = executor;
    }

    public PipelineOutcome run(UUID parentRunId, AnalysisInput input, CouncilPlan plan, ActiveRun activeRun) {
        ProgressSink parentSink = activeRun.sink();
        markParentLevels(plan.parentLevels(), parentSink, LevelState.RUNNING);

        List<ChildRun> children = plan.voices().stream()
                .map(voicePlan -> new ChildRun(voicePlan, runService.createSingle(input.reviewId(), parentRunId,
                        voicePlan.voice(), voicePlan.levels(), input.instructions(), input.headSha()).getId()))
                .toList();
        log.info("Council {} started {} voices", parentRunId, children.size());

        List<CompletableFuture<ChildResult>> futures = children.stream()
                .map(child -> CompletableFuture.supplyAsync(() -> runChild(child, input, activeRun), executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        List<ChildResult> results = futures.stream().map(CompletableFuture::join).toList();

        if (activeRun.getToken().isCancelled()) {
            log.info("Council {} cancelled", parentRunId);
            return PipelineOutcome.cancelled();
        }

        List<ChildResult> succeeded = results.stream().filter(r -> r.outcome().isCompleted()).toList();
        log.info("Council {}: {}/{} voices succeeded", parentRunId, succeeded.size(), results.size());
        if (succeeded.isEmpty()) {
            markParentLevels(plan.parentLevels(), parentSink, LevelState.FAILED);
            parentSink.level(ProgressSink.FINAL, LevelState.FAILED, "All voices failed");
            return PipelineOutcome.failed("All %d council voices failed: %s".formatted(results.size(),
                    results.get(0).outcome().failureReason()));
        }
        markParentLevels(plan.parentLevels(), parentSink, LevelState.COMPLETED);

        List<SuggestionDraft> candidates = succeeded.stream()
                .flatMap(r -> r.outcome().suggestions().stream())
                .toList();
        if (plan.consolidationVoice() == null) {
            return promote(parentRunId, input, succeeded.get(0), parentSink);
        }
        return consolidate(parentRunId, input, plan.consolidationVoice(), candidates, succeeded.size(), activeRun);
    }

    // ── Internal ───────────────────────────────────────────────────

    private record ChildRun(VoicePlan plan, UUID runId) {}

    private record ChildResult(ChildRun child, PipelineOutcome outcome) {}

    private ChildResult runChild(ChildRun child, AnalysisInput input, ActiveRun activeRun) {
        VoicePlan plan = child.plan();
        PipelineRequest request = new PipelineRequest(child.runId(), input, plan.voice(), plan.index(),
                plan.voiceId(), plan.levels(), true);
        PipelineOutcome outcome;
        try {
            outcome = pipeline.run(request, activeRun.voiceSink(plan.voiceId()), activeRun.getToken());
        } catch (RuntimeException e) {
            log.error("Council voice {} failed on run {}: {}", plan.voiceId(), child.runId(), e.getMessage(), e);
            outcome = PipelineOutcome.failed(e.getMessage());
        }
        try {
            runService.update(child.runId(), outcome.toRunUpdate());
        } catch (RuntimeException e) {
            log.error("Could not record outcome of child run {}: {}", child.runId(), e.getMessage(), e);
        }
        return new ChildResult(child, outcome);
    }

    /** A council of one without a consolidation voice: the child's final set becomes the parent's. */
    private PipelineOutcome promote(UUID parentRunId, AnalysisInput input, ChildResult only, ProgressSink sink) {
        List<SuggestionDraft> finals = only.outcome().suggestions();
        suggestionService.storeSuggestions(input.reviewId(), parentRunId, finals, false,
                only.child().plan().voiceId());
        sink.level(ProgressSink.FINAL, LevelState.COMPLETED, "%d final suggestions".formatted(finals.size()));
        log.info("Council {} promoted {} suggestions from its only voice", parentRunId, finals.size());
        return PipelineOutcome.completed(finals, only.outcome().summary());
    }

    private PipelineOutcome consolidate(UUID parentRunId, AnalysisInput input, VoiceSpec voice,
                                        List<SuggestionDraft> candidates, int sources, ActiveRun activeRun) {
        ProgressSink sink = activeRun.sink();
        sink.level(ProgressSink.FINAL, LevelState.RUNNING,
                "Consolidating %d suggestions from %d voices".formatted(candidates.size(), sources));

        List<SuggestionDraft> merged;
        String summary = null;
        if (candidates.isEmpty()) {
            merged = List.of();
        } else {
            try {
                String prompt = PromptBuilder.consolidationPrompt(voice.tier(), input, candidates, sources);
                VoiceResponse response = voiceRunner.invoke(
                        new VoiceRequest(voice, PromptType.CONSOLIDATION, prompt, input.workingDirectory()),
                        event -> sink.level(ProgressSink.FINAL, LevelState.RUNNING, event.describe()));
                merged = SuggestionMerger.deduplicate(response.suggestions());
                summary = response.summary();
            } catch (VoiceInvocationException e) {
                log.warn("Council consolidation failed for run {}, using deterministic merge: {}",
                        parentRunId, e.getMessage());
                merged = SuggestionMerger.deduplicate(candidates);
            }
        }

        if (activeRun.getToken().isCancelled()) {
            log.info("Council {} cancelled during consolidation", parentRunId);
            return PipelineOutcome.cancelled();
        }

        List<SuggestionDraft> finals = merged.stream().map(s -> s.atLevel(null)).toList();
        suggestionService.storeSuggestions(input.reviewId(), parentRunId, finals, false, voice.key());
        sink.level(ProgressSink.FINAL, LevelState.COMPLETED, "%d final suggestions".formatted(finals.size()));
        log.info("Council {} consolidated {} raw suggestions into {}", parentRunId, candidates.size(), finals.size());

        if (summary == null || summary.isBlank()) {
            summary = "%d suggestions from %d voices".formatted(finals.size(), sources);
        }
        return PipelineOutcome.completed(finals, summary);
    }

    private static void markParentLevels(EnabledLevels levels, ProgressSink sink, LevelState state) {
        for (int level = 1; level <= EnabledLevels.MAX_LEVEL; level++) {
            String key = ProgressSink.levelKey(level);
            if (levels.isEnabled(level)) sink.level(key, state, null);
            else if (state == LevelState.RUNNING) sink.level(key, LevelState.SKIPPED, "Level %d disabled".formatted(level));
        }
    }
}
