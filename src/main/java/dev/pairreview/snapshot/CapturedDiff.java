package dev.pairreview.snapshot;

import dev.pairreview.domain.valueobject.DiffStats;

/**
 * Output of a capture: the reviewable diff text, its stats and the digest taken at the same time.
 * {@code digest} is null when it could not be computed.
 */
public record CapturedDiff(String diffText, DiffStats stats, String digest) {
}
