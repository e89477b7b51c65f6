package dev.pairreview.analysis.council;

import dev.pairreview.analysis.AnalysisInput;
import dev.pairreview.analysis.council.CouncilPlan.VoicePlan;
import dev.pairreview.analysis.pipeline.LevelPipeline;
import dev.pairreview.analysis.pipeline.PipelineOutcome;
import dev.pairreview.analysis.pipeline.PipelineRequest;
import dev.pairreview.analysis.progress.ActiveRun;
import dev.pairreview.analysis.voice.VoiceInvocationException;
import dev.pairreview.analysis.voice.VoiceRequest;
import dev.pairreview.analysis.voice.VoiceResponse;
import dev.pairreview.analysis.voice.VoiceRunner;
import dev.pairreview.domain.entity.AnalysisRun;
import dev.pairreview.domain.enums.RunStatus;
import dev.pairreview.domain.enums.Side;
import dev.pairreview.domain.enums.VoiceTier;
import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.RunUpdate;
import dev.pairreview.domain.valueobject.SuggestionDraft;
import dev.pairreview.domain.valueobject.VoiceSpec;
import dev.pairreview.service.AnalysisRunService;
import dev.pairreview.service.SuggestionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CouncilCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final UUID PARENT_ID = UUID.randomUUID();
    private static final VoiceSpec CLAUDE = new VoiceSpec("claude", "sonnet", VoiceTier.BALANCED);
    private static final VoiceSpec GEMINI = new VoiceSpec("gemini", "pro", VoiceTier.THOROUGH);
    private static final VoiceSpec CODEX = new VoiceSpec("codex", "o3", VoiceTier.FAST);

    private LevelPipeline pipeline;
    private VoiceRunner voiceRunner;
    private AnalysisRunService runService;
    private SuggestionService suggestionService;
    private ExecutorService executor;
    private CouncilCoordinator coordinator;
    private ActiveRun activeRun;
    private List<UUID> childIds;

    @BeforeEach
    void setUp() {
        pipeline = mock(LevelPipeline.class);
        voiceRunner = mock(VoiceRunner.class);
        runService = mock(AnalysisRunService.class);
        suggestionService = mock(SuggestionService.class);
        executor = Executors.newFixedThreadPool(3);
        coordinator = new CouncilCoordinator(pipeline, voiceRunner, runService, suggestionService, executor);
        activeRun = new ActiveRun(PARENT_ID, 1L, status -> { }, Clock.fixed(NOW, ZoneOffset.UTC));

        childIds = new ArrayList<>();
        when(runService.createSingle(anyLong(), any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            AnalysisRun child = AnalysisRun.createSingle(1L, PARENT_ID, invocation.getArgument(2),
                    invocation.getArgument(3), null, null, "abc1234", NOW);
            synchronized (childIds) {
                childIds.add(child.getId());
            }
            return child;
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("three voices are consolidated over every raw suggestion")
    void consolidatesAllVoices() {
        stubVoiceOutcome(0, PipelineOutcome.completed(drafts("a.js", 2), "a"));
        stubVoiceOutcome(1, PipelineOutcome.completed(drafts("b.js", 3), "b"));
        stubVoiceOutcome(2, PipelineOutcome.completed(drafts("c.js", 1), "c"));
        when(voiceRunner.invoke(any(), any()))
                .thenReturn(new VoiceResponse(drafts("a.js", 2), "Two issues worth fixing", "raw"));

        PipelineOutcome outcome = coordinator.run(PARENT_ID, input(), plan(CLAUDE, GEMINI, CODEX), activeRun);

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.suggestions()).hasSize(2);
        assertThat(outcome.toRunUpdate().totalSuggestions()).isEqualTo(2);
        assertThat(outcome.summary()).isEqualTo("Two issues worth fixing");

        ArgumentCaptor<VoiceRequest> captor = ArgumentCaptor.forClass(VoiceRequest.class);
        verify(voiceRunner).invoke(captor.capture(), any());
        assertThat(captor.getValue().voice()).isEqualTo(CLAUDE);
        assertThat(captor.getValue().prompt()).contains("[c6]").doesNotContain("[c7]");

        verify(suggestionService).storeSuggestions(eq(1L), eq(PARENT_ID),
                argThat(list -> list.size() == 2 && list.stream().allMatch(s -> s.level() == null)),
                eq(false), eq(CLAUDE.key()));
        assertThat(childIds).hasSize(3);
        childIds.forEach(id -> verify(runService).update(eq(id), argThat(u -> u.status() == RunStatus.COMPLETED)));
    }

    @Test
    @DisplayName("a failed voice is recorded on its child and the rest still consolidate")
    void oneVoiceFails() {
        stubVoiceOutcome(0, PipelineOutcome.completed(drafts("a.js", 1), "a"));
        stubVoiceOutcome(1, PipelineOutcome.failed("Level 1 failed: boom"));
        when(voiceRunner.invoke(any(), any()))
                .thenThrow(new VoiceInvocationException(CLAUDE.key(), "consolidation timed out"));

        PipelineOutcome outcome = coordinator.run(PARENT_ID, input(), plan(CLAUDE, GEMINI), activeRun);

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.suggestions()).hasSize(1);
        assertThat(outcome.summary()).isEqualTo("1 suggestions from 1 voices");
        verify(runService).update(any(), argThat(u -> u.status() == RunStatus.FAILED));
    }

    @Test
    @DisplayName("all voices failing fails the council")
    void allVoicesFail() {
        stubVoiceOutcome(0, PipelineOutcome.failed("Level 1 failed: a"));
        stubVoiceOutcome(1, PipelineOutcome.failed("Level 1 failed: b"));

        PipelineOutcome outcome = coordinator.run(PARENT_ID, input(), plan(CLAUDE, GEMINI), activeRun);

        assertThat(outcome.kind()).isEqualTo(PipelineOutcome.Kind.FAILED);
        assertThat(outcome.failureReason()).startsWith("All 2 council voices failed");
        verify(voiceRunner, never()).invoke(any(), any());
        verify(suggestionService, never()).storeSuggestions(anyLong(), any(), anyList(), anyBoolean(), anyString());
    }

    @Test
    @DisplayName("a council of one without a consolidator promotes its final set")
    void promotesSingleVoice() {
        stubVoiceOutcome(0, PipelineOutcome.completed(drafts("a.js", 3), "solo"));
        CouncilPlan plan = new CouncilPlan(List.of(new VoicePlan(0, CLAUDE, EnabledLevels.all())), null,
                EnabledLevels.all());

        PipelineOutcome outcome = coordinator.run(PARENT_ID, input(), plan, activeRun);

        assertThat(outcome.suggestions()).hasSize(3);
        assertThat(outcome.summary()).isEqualTo("solo");
        verify(voiceRunner, never()).invoke(any(), any());
        verify(suggestionService).storeSuggestions(eq(1L), eq(PARENT_ID), anyList(), eq(false),
                eq(CLAUDE.key() + "#0"));
    }

    @Test
    @DisplayName("cancellation while voices run cancels the council and every child")
    void cancelledWhileRunning() {
        when(pipeline.run(any(), any(), any())).thenAnswer(invocation -> {
            activeRun.cancel();
            return PipelineOutcome.cancelled();
        });

        PipelineOutcome outcome = coordinator.run(PARENT_ID, input(), plan(CLAUDE, GEMINI), activeRun);

        assertThat(outcome.kind()).isEqualTo(PipelineOutcome.Kind.CANCELLED);
        verify(runService, times(2)).update(any(), eq(RunUpdate.cancelled()));
        verify(voiceRunner, never()).invoke(any(), any());
    }

    // ── Test Fixtures ───────────────────────────────────────────────

    private void stubVoiceOutcome(int voiceIndex, PipelineOutcome outcome) {
        when(pipeline.run(argThat((PipelineRequest r) -> r != null && r.voiceIndex() == voiceIndex), any(), any()))
                .thenReturn(outcome);
    }

    private static CouncilPlan plan(VoiceSpec... voices) {
        EnabledLevels levels = new EnabledLevels(true, false, false);
        List<VoicePlan> plans = IntStream.range(0, voices.length)
                .mapToObj(i -> new VoicePlan(i, voices[i], levels))
                .toList();
        return new CouncilPlan(plans, voices[0], levels);
    }

    private static AnalysisInput input() {
        return new AnalysisInput(1L, "acme/shop", "abc1234", Path.of("/tmp/wt"), "diff",
                List.of("a.js", "b.js", "c.js"), null);
    }

    private static List<SuggestionDraft> drafts(String file, int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new SuggestionDraft(file, 10 * (i + 1), null, Side.RIGHT, "bug",
                        "Issue " + i, "body " + i, null, 0.8, false, null, 0))
                .toList();
    }
}
