package dev.pairreview.analysis.pipeline;

import dev.pairreview.analysis.progress.CancellationToken;
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
import dev.pairreview.service.SuggestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one voice through the enabled analysis levels and consolidates the result.
 *
 * <pre>
 *  level 1 ──► level 2 ──► level 3 ──► consolidation ──► final set (ai_level = null)
 *     │           │           │
 *     └── each level sees the previous level's findings and stores its own (ai_level = n)
 * </pre>
 *
 * <p>Cancellation is checked before and after every level and before consolidation. A voice
 * failure stops the remaining levels; suggestions already stored are kept.
 */
@Component
public class LevelPipeline {

    private static final Logger log = LoggerFactory.getLogger(LevelPipeline.class);

    private final VoiceRunner voiceRunner;
    private final SuggestionService suggestionService;

    public LevelPipeline(VoiceRunner voiceRunner, SuggestionService suggestionService) {
        this.voiceRunner = voiceRunner;
        this.suggestionService = suggestionService;
    }

    public PipelineOutcome run(PipelineRequest request, ProgressSink sink, CancellationToken token) {
        EnabledLevels levels = request.levels();
        List<List<SuggestionDraft>> perLevel = new ArrayList<>();
        List<SuggestionDraft> prior = List.of();
        String lastSummary = null;

        for (int level = 1; level <= EnabledLevels.MAX_LEVEL; level++) {
            String key = ProgressSink.levelKey(level);
            if (!levels.isEnabled(level)) {
                sink.level(key, LevelState.SKIPPED, "Level %d disabled".formatted(level));
                continue;
            }
            if (token.isCancelled()) return cancelled(request, "before level " + level);

            sink.level(key, LevelState.RUNNING, "Running level %d analysis".formatted(level));
            VoiceResponse response;
            try {
                response = voiceRunner.invoke(levelRequest(request, level, prior),
                        event -> sink.level(key, LevelState.RUNNING, event.describe()));
            } catch (VoiceInvocationException e) {
                log.warn("Level {} failed for {} on run {}: {}", level, request.voiceId(), request.runId(),
                        e.getMessage());
                sink.level(key, LevelState.FAILED, e.getMessage());
                skipAfter(level, levels, sink);
                return PipelineOutcome.failed("Level %d failed: %s".formatted(level, e.getMessage()));
            }

            final int current = level;
            List<SuggestionDraft> found = response.suggestions().stream()
                    .map(s -> s.atLevel(current).fromVoice(request.voiceIndex()))
                    .toList();
            suggestionService.storeSuggestions(request.input().reviewId(), request.runId(), found,
                    request.raw(), request.voiceId());
            sink.level(key, LevelState.COMPLETED, "Level %d found %d suggestions".formatted(level, found.size()));
            log.info("Level {} of run {} ({}) produced {} suggestions", level, request.runId(),
                    request.voiceId(), found.size());

            perLevel.add(found);
            prior = found;
            if (response.summary() != null && !response.summary().isBlank()) lastSummary = response.summary();

            if (token.isCancelled()) return cancelled(request, "after level " + level);
        }

        if (token.isCancelled()) return cancelled(request, "before consolidation");
        return consolidate(request, perLevel, lastSummary, sink, token);
    }

    // ── Internal ───────────────────────────────────────────────────

    private PipelineOutcome consolidate(PipelineRequest request, List<List<SuggestionDraft>> perLevel,
                                        String lastSummary, ProgressSink sink, CancellationToken token) {
        sink.level(ProgressSink.FINAL, LevelState.RUNNING, "Consolidating suggestions");
        List<SuggestionDraft> candidates = perLevel.stream().flatMap(List::stream).toList();
        long sources = perLevel.stream().filter(l -> !l.isEmpty()).count();

        List<SuggestionDraft> merged;
        String summary = lastSummary;
        if (sources > 1) {
            try {
                VoiceResponse response = voiceRunner.invoke(consolidationRequest(request, candidates, (int) sources),
                        event -> sink.level(ProgressSink.FINAL, LevelState.RUNNING, event.describe()));
                merged = SuggestionMerger.deduplicate(response.suggestions().stream()
                        .map(s -> s.fromVoice(request.voiceIndex()))
                        .toList());
                if (response.summary() != null && !response.summary().isBlank()) summary = response.summary();
            } catch (VoiceInvocationException e) {
                log.warn("Consolidation failed for run {} ({}), using deterministic merge: {}",
                        request.runId(), request.voiceId(), e.getMessage());
                merged = SuggestionMerger.deduplicate(candidates);
            }
        } else {
            log.debug("Run {} has output from {} level(s), merging without a voice", request.runId(), sources);
            merged = SuggestionMerger.deduplicate(candidates);
        }

        if (token.isCancelled()) return cancelled(request, "during consolidation");

        List<SuggestionDraft> finals = merged.stream().map(s -> s.atLevel(null)).toList();
        suggestionService.storeSuggestions(request.input().reviewId(), request.runId(), finals,
                request.raw(), request.voiceId());
        sink.level(ProgressSink.FINAL, LevelState.COMPLETED, "%d final suggestions".formatted(finals.size()));

        if (summary == null) summary = "%d suggestions".formatted(finals.size());
        return PipelineOutcome.completed(finals, summary);
    }

    private VoiceRequest levelRequest(PipelineRequest request, int level, List<SuggestionDraft> prior) {
        String prompt = PromptBuilder.levelPrompt(level, request.voice().tier(), request.input(), prior);
        return new VoiceRequest(request.voice(), PromptType.forLevel(level), prompt,
                request.input().workingDirectory());
    }

    private VoiceRequest consolidationRequest(PipelineRequest request, List<SuggestionDraft> candidates,
                                              int sources) {
        String prompt = PromptBuilder.consolidationPrompt(request.voice().tier(), request.input(), candidates,
                sources);
        return new VoiceRequest(request.voice(), PromptType.CONSOLIDATION, prompt,
                request.input().workingDirectory());
    }

    private PipelineOutcome cancelled(PipelineRequest request, String checkpoint) {
        log.info("Run {} ({}) cancelled {}", request.runId(), request.voiceId(), checkpoint);
        return PipelineOutcome.cancelled();
    }

    private static void skipAfter(int failedLevel, EnabledLevels levels, ProgressSink sink) {
        for (int level = failedLevel + 1; level <= EnabledLevels.MAX_LEVEL; level++) {
            if (levels.isEnabled(level))
                sink.level(ProgressSink.levelKey(level), LevelState.SKIPPED, "Skipped after level %d failed"
                        .formatted(failedLevel));
        }
        sink.level(ProgressSink.FINAL, LevelState.SKIPPED, "Skipped after level %d failed".formatted(failedLevel));
    }
}
