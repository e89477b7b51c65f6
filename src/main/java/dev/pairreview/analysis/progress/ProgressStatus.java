package dev.pairreview.analysis.progress;

import dev.pairreview.domain.enums.RunStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable progress snapshot of a tracked run. {@code voices} is empty for single-voice runs and
 * holds one level map per council voice otherwise.
 */
public record ProgressStatus(UUID runId, long reviewId, RunStatus status, String message,
                             Map<String, LevelProgress> levels,
                             Map<String, Map<String, LevelProgress>> voices,
                             Instant updatedAt) {
}
