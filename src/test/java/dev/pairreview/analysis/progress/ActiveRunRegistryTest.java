package dev.pairreview.analysis.progress;

import dev.pairreview.config.AnalysisProperties;
import dev.pairreview.domain.enums.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActiveRunRegistryTest {

    private MutableClock clock;
    private ProgressBroadcaster broadcaster;
    private ActiveRunRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        broadcaster = new ProgressBroadcaster(Runnable::run, AnalysisProperties.defaults());
        registry = new ActiveRunRegistry(broadcaster, clock, AnalysisProperties.defaults());
    }

    @Test
    @DisplayName("a second run of the same review is rejected while the first executes")
    void oneRunPerReview() {
        UUID first = UUID.randomUUID();
        registry.register(first, 1L);

        assertThatThrownBy(() -> registry.register(UUID.randomUUID(), 1L))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(first.toString());
        assertThat(registry.register(UUID.randomUUID(), 2L)).isNotNull();
    }

    @Test
    @DisplayName("a finished run frees its review")
    void finishedRunFreesReview() {
        ActiveRun run = registry.register(UUID.randomUUID(), 1L);
        run.finish(RunStatus.COMPLETED, "done");
        registry.markFinished(run);

        assertThat(registry.findRunningByReview(1L)).isEmpty();
        assertThat(registry.register(UUID.randomUUID(), 1L)).isNotNull();
    }

    @Test
    @DisplayName("finished runs stay queryable until the retention window passes")
    void pruneAfterRetention() {
        UUID runId = UUID.randomUUID();
        ActiveRun run = registry.register(runId, 1L);
        ActiveRun running = registry.register(UUID.randomUUID(), 2L);
        run.cancel();
        registry.markFinished(run);

        clock.advance(Duration.ofMinutes(1));
        registry.pruneExpired();
        assertThat(registry.get(runId)).isPresent();

        clock.advance(Duration.ofMinutes(2));
        registry.pruneExpired();
        assertThat(registry.get(runId)).isEmpty();
        assertThat(registry.get(running.getRunId())).isPresent();
        assertThat(registry.size()).isEqualTo(1);
        assertThat(broadcaster.subscribe(runId, status -> { })).isEmpty();
        assertThat(broadcaster.subscribe(running.getRunId(), status -> { })).isPresent();
    }

    @Test
    @DisplayName("registration publishes the initial snapshot")
    void publishesInitialSnapshot() {
        UUID runId = UUID.randomUUID();
        registry.register(runId, 1L);

        ProgressStatus[] received = new ProgressStatus[1];
        broadcaster.subscribe(runId, status -> received[0] = status);

        assertThat(received[0]).isNotNull();
        assertThat(received[0].message()).isEqualTo("Starting analysis");
    }

    // ── Test Fixtures ───────────────────────────────────────────────

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
