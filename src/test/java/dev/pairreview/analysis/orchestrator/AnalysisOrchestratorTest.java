package dev.pairreview.analysis.orchestrator;

import dev.pairreview.analysis.AnalysisInput;
import dev.pairreview.analysis.council.CouncilCoordinator;
import dev.pairreview.analysis.pipeline.LevelPipeline;
import dev.pairreview.analysis.pipeline.PipelineOutcome;
import dev.pairreview.analysis.progress.ActiveRun;
import dev.pairreview.analysis.progress.ActiveRunRegistry;
import dev.pairreview.analysis.progress.ProgressBroadcaster;
import dev.pairreview.config.AnalysisProperties;
import dev.pairreview.config.VoiceProperties;
import dev.pairreview.domain.entity.AnalysisRun;
import dev.pairreview.domain.enums.RunStatus;
import dev.pairreview.domain.enums.VoiceTier;
import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.RunUpdate;
import dev.pairreview.domain.valueobject.VoiceSpec;
import dev.pairreview.dto.request.AnalysisRequest;
import dev.pairreview.dto.response.AnalysisStartedResponse;
import dev.pairreview.dto.response.CancelResponse;
import dev.pairreview.service.AnalysisRunService;
import dev.pairreview.service.ReviewService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisOrchestratorTest {

    private static final long REVIEW_ID = 42L;
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private LevelPipeline pipeline;
    private AnalysisRunService runService;
    private ReviewService reviewService;
    private ActiveRunRegistry registry;
    private Deque<Runnable> scheduled;
    private SimpleMeterRegistry meterRegistry;
    private AnalysisOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        pipeline = mock(LevelPipeline.class);
        runService = mock(AnalysisRunService.class);
        reviewService = mock(ReviewService.class);
        registry = new ActiveRunRegistry(new ProgressBroadcaster(Runnable::run, AnalysisProperties.defaults()),
                Clock.systemUTC(), AnalysisProperties.defaults());
        scheduled = new ArrayDeque<>();
        ExecutorService executor = mock(ExecutorService.class);
        doAnswer(invocation -> {
            scheduled.add(invocation.getArgument(0));
            return null;
        }).when(executor).execute(any());
        meterRegistry = new SimpleMeterRegistry();

        orchestrator = new AnalysisOrchestrator(pipeline, mock(CouncilCoordinator.class), runService, reviewService,
                registry, new VoiceProperties("claude", "sonnet", VoiceTier.BALANCED, Map.of()), executor,
                meterRegistry);

        when(reviewService.loadAnalysisInput(eq(REVIEW_ID), any())).thenReturn(new AnalysisInput(REVIEW_ID,
                "acme/shop", "abc1234", Path.of("/tmp/wt"), "diff", List.of("a.js", "b.js"), null));
        when(runService.createSingle(anyLong(), isNull(), any(), any(), any(), any())).thenAnswer(invocation ->
                AnalysisRun.createSingle(REVIEW_ID, null, invocation.getArgument(2), invocation.getArgument(3),
                        null, null, "abc1234", NOW));
    }

    @Nested
    @DisplayName("Starting")
    class Starting {

        @Test
        @DisplayName("defaults fill in a bare request and the run executes to completion")
        void startsWithDefaults() {
            when(pipeline.run(any(), any(), any())).thenReturn(PipelineOutcome.completed(List.of(), "clean"));
            when(runService.update(any(), any())).thenReturn(true);

            AnalysisStartedResponse started = orchestrator.startSingle(REVIEW_ID,
                    new AnalysisRequest(null, null, null, null, null, null));
            assertThat(started.status()).isEqualTo(RunStatus.RUNNING);
            assertThat(started.voices()).isEqualTo(1);

            ArgumentCaptor<VoiceSpec> voice = ArgumentCaptor.forClass(VoiceSpec.class);
            verify(runService).createSingle(eq(REVIEW_ID), isNull(), voice.capture(), eq(EnabledLevels.all()),
                    any(), eq("abc1234"));
            assertThat(voice.getValue().key()).isEqualTo("claude/sonnet/balanced");

            scheduled.poll().run();

            verify(runService).update(started.runId(), RunUpdate.progress(2));
            verify(runService).update(started.runId(), RunUpdate.completed("clean", 0));
            verify(reviewService).updateSummary(REVIEW_ID, "clean");
            assertThat(registry.get(started.runId()).map(ActiveRun::getStatus)).contains(RunStatus.COMPLETED);
            assertThat(registry.findRunningByReview(REVIEW_ID)).isEmpty();
            assertThat(meterRegistry.find("pairreview.analysis.duration").tag("outcome", "completed").timer())
                    .isNotNull();
        }

        @Test
        @DisplayName("a request with every level disabled is rejected before a run exists")
        void rejectsNoLevels() {
            AnalysisRequest request = new AnalysisRequest("claude", "opus", "fast",
                    Map.of("1", false, "2", false, "3", false), null, null);

            assertThatThrownBy(() -> orchestrator.startSingle(REVIEW_ID, request))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(runService, never()).createSingle(anyLong(), any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("a second analysis of a busy review is rejected")
        void rejectsConcurrentRun() {
            orchestrator.startSingle(REVIEW_ID, new AnalysisRequest(null, null, null, null, null, null));

            assertThatThrownBy(() -> orchestrator.startSingle(REVIEW_ID,
                    new AnalysisRequest(null, null, null, null, null, null)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already running");
        }

        @Test
        @DisplayName("an exception from the pipeline fails the run")
        void pipelineExceptionFails() {
            when(pipeline.run(any(), any(), any())).thenThrow(new IllegalStateException("disk full"));

            AnalysisStartedResponse started = orchestrator.startSingle(REVIEW_ID,
                    new AnalysisRequest(null, null, null, null, null, null));
            scheduled.poll().run();

            verify(runService).update(started.runId(), RunUpdate.failed("disk full"));
            assertThat(registry.get(started.runId()).get().getStatus()).isEqualTo(RunStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("Cancelling")
    class Cancelling {

        @Test
        @DisplayName("cancel flips a tracked run immediately and the late outcome never overwrites it")
        void cancelTrackedRun() {
            when(runService.cancelWithChildren(any())).thenReturn(true);
            when(runService.require(any())).thenReturn(storedRun(null, RunUpdate.cancelled()));
            AnalysisStartedResponse started = orchestrator.startSingle(REVIEW_ID,
                    new AnalysisRequest(null, null, null, null, null, null));
            when(pipeline.run(any(), any(), any())).thenReturn(PipelineOutcome.cancelled());

            CancelResponse response = orchestrator.cancel(started.runId());
            assertThat(response.cancelled()).isTrue();
            assertThat(response.status()).isEqualTo(RunStatus.CANCELLED);

            scheduled.poll().run();

            verify(runService, never()).update(eq(started.runId()),
                    argThat(update -> update.status() == RunStatus.FAILED));
            verify(reviewService, never()).updateSummary(anyLong(), any());
            assertThat(registry.get(started.runId()).get().getStatus()).isEqualTo(RunStatus.CANCELLED);
        }

        @Test
        @DisplayName("cancelling twice is acknowledged without a second store write")
        void cancelIsIdempotent() {
            when(runService.cancelWithChildren(any())).thenReturn(true);
            AnalysisStartedResponse started = orchestrator.startSingle(REVIEW_ID,
                    new AnalysisRequest(null, null, null, null, null, null));
            orchestrator.cancel(started.runId());

            CancelResponse second = orchestrator.cancel(started.runId());

            assertThat(second.cancelled()).isFalse();
            assertThat(second.status()).isEqualTo(RunStatus.CANCELLED);
            verify(runService).cancelWithChildren(started.runId());
        }

        @Test
        @DisplayName("an untracked terminal run is acknowledged with its stored status")
        void untrackedTerminalRun() {
            AnalysisRun stored = AnalysisRun.createSingle(REVIEW_ID, null,
                    new VoiceSpec("claude", "sonnet", VoiceTier.FAST), EnabledLevels.all(), null, null, "abc", NOW);
            stored.apply(RunUpdate.completed("done", 3), NOW);
            when(runService.require(stored.getId())).thenReturn(stored);

            CancelResponse response = orchestrator.cancel(stored.getId());

            assertThat(response.cancelled()).isFalse();
            assertThat(response.status()).isEqualTo(RunStatus.COMPLETED);
            verify(runService, never()).cancelWithChildren(any());
        }

        @Test
        @DisplayName("an untracked running row is cancelled in the store")
        void untrackedRunningRow() {
            UUID runId = UUID.randomUUID();
            AnalysisRun stored = AnalysisRun.createSingle(REVIEW_ID, null,
                    new VoiceSpec("claude", "sonnet", VoiceTier.FAST), EnabledLevels.all(), null, null, "abc", NOW);
            when(runService.require(runId)).thenReturn(stored);
            when(runService.cancelWithChildren(runId)).thenReturn(true);

            CancelResponse response = orchestrator.cancel(runId);

            assertThat(response.cancelled()).isTrue();
            assertThat(response.status()).isEqualTo(RunStatus.CANCELLED);
        }

        @Test
        @DisplayName("a cancel that loses the race with completion reports the stored status")
        void cancelAfterCompletionWasStored() {
            AnalysisStartedResponse started = orchestrator.startSingle(REVIEW_ID,
                    new AnalysisRequest(null, null, null, null, null, null));
            when(runService.cancelWithChildren(started.runId())).thenReturn(false);
            when(runService.require(started.runId())).thenReturn(storedRun(null, RunUpdate.completed("done", 1)));

            CancelResponse response = orchestrator.cancel(started.runId());

            assertThat(response.cancelled()).isFalse();
            assertThat(response.status()).isEqualTo(RunStatus.COMPLETED);
            ActiveRun active = registry.get(started.runId()).orElseThrow();
            assertThat(active.getStatus()).isEqualTo(RunStatus.RUNNING);
            assertThat(active.getToken().isCancelled()).isFalse();
        }

        @Test
        @DisplayName("an outcome arriving after the row became terminal takes the stored status")
        void lateOutcomeAdoptsStoredStatus() {
            AnalysisStartedResponse started = orchestrator.startSingle(REVIEW_ID,
                    new AnalysisRequest(null, null, null, null, null, null));
            when(pipeline.run(any(), any(), any())).thenReturn(PipelineOutcome.completed(List.of(), "clean"));
            when(runService.update(any(), any())).thenReturn(false);
            when(runService.require(started.runId())).thenReturn(storedRun(null, RunUpdate.cancelled()));

            scheduled.poll().run();

            assertThat(registry.get(started.runId()).orElseThrow().getStatus()).isEqualTo(RunStatus.CANCELLED);
            verify(reviewService, never()).updateSummary(anyLong(), any());
        }

        @Test
        @DisplayName("a running council voice cannot be cancelled on its own")
        void runningCouncilVoiceIsRejected() {
            UUID parentId = UUID.randomUUID();
            AnalysisRun child = storedRun(parentId, null);
            when(runService.require(child.getId())).thenReturn(child);

            assertThatThrownBy(() -> orchestrator.cancel(child.getId()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining(parentId.toString());
            verify(runService, never()).cancelWithChildren(any());
        }

        @Test
        @DisplayName("a finished council voice is acknowledged with its status")
        void finishedCouncilVoiceIsAcknowledged() {
            AnalysisRun child = storedRun(UUID.randomUUID(), RunUpdate.completed("ok", 2));
            when(runService.require(child.getId())).thenReturn(child);

            CancelResponse response = orchestrator.cancel(child.getId());

            assertThat(response.cancelled()).isFalse();
            assertThat(response.status()).isEqualTo(RunStatus.COMPLETED);
        }
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private static AnalysisRun storedRun(UUID parentRunId, RunUpdate update) {
        AnalysisRun run = AnalysisRun.createSingle(REVIEW_ID, parentRunId,
                new VoiceSpec("claude", "sonnet", VoiceTier.FAST), EnabledLevels.all(), null, null, "abc", NOW);
        if (update != null) run.apply(update, NOW);
        return run;
    }
}
