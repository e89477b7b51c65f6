package dev.pairreview.analysis.progress;

import dev.pairreview.domain.enums.LevelState;
import dev.pairreview.domain.enums.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActiveRunTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private List<ProgressStatus> published;
    private ActiveRun run;

    @BeforeEach
    void setUp() {
        published = new ArrayList<>();
        run = new ActiveRun(UUID.randomUUID(), 7L, published::add, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("starts with every level pending")
    void initialSnapshot() {
        ProgressStatus status = run.snapshot();

        assertThat(status.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(status.levels()).containsOnlyKeys("1", "2", "3", "final");
        assertThat(status.levels().values()).allMatch(p -> p.state() == LevelState.PENDING);
        assertThat(status.voices()).isEmpty();
    }

    @Test
    @DisplayName("level updates are published in order and carry the latest message")
    void publishesLevelUpdates() {
        run.sink().level("1", LevelState.RUNNING, "Running level 1 analysis");
        run.sink().level("1", LevelState.COMPLETED, null);

        assertThat(published).hasSize(2);
        ProgressStatus last = published.get(1);
        assertThat(last.levels().get("1").state()).isEqualTo(LevelState.COMPLETED);
        assertThat(last.message()).isEqualTo("Running level 1 analysis");
    }

    @Test
    @DisplayName("cancel marks unsettled levels of the run and its voices cancelled")
    void cancelMarksLevels() {
        ProgressSink voice = run.voiceSink("claude/sonnet/balanced#0");
        run.sink().level("1", LevelState.COMPLETED, "done");
        voice.level("1", LevelState.RUNNING, "thinking");

        assertThat(run.cancel()).isTrue();

        ProgressStatus status = run.snapshot();
        assertThat(status.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(status.levels().get("1").state()).isEqualTo(LevelState.COMPLETED);
        assertThat(status.levels().get("2").state()).isEqualTo(LevelState.CANCELLED);
        assertThat(status.voices().get("claude/sonnet/balanced#0").get("1").state())
                .isEqualTo(LevelState.CANCELLED);
        assertThat(run.getToken().isCancelled()).isTrue();
        assertThat(run.getFinishedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("after cancel, level updates and finish are ignored")
    void terminalIsFinal() {
        run.cancel();
        int before = published.size();

        run.sink().level("2", LevelState.COMPLETED, "late");

        assertThat(run.finish(RunStatus.FAILED, "boom")).isFalse();
        assertThat(run.cancel()).isFalse();
        assertThat(published).hasSize(before);
        assertThat(run.getStatus()).isEqualTo(RunStatus.CANCELLED);
    }

    @Test
    void finishRequiresTerminalStatus() {
        assertThatThrownBy(() -> run.finish(RunStatus.RUNNING, "nope"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
