package dev.pairreview.dto.response;

import dev.pairreview.domain.valueobject.DiffStats;

import java.time.Instant;

public record SnapshotResponse(long reviewId, String digest, DiffStats stats, Instant capturedAt) {}
