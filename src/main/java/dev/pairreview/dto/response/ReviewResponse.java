package dev.pairreview.dto.response;

import dev.pairreview.domain.enums.ReviewKind;
import dev.pairreview.domain.enums.ReviewStatus;

import java.time.Instant;

public record ReviewResponse(
        long id, String repository, ReviewKind kind, ReviewStatus status,
        Integer prNumber, String baseSha, String headSha, String localPath,
        String summary, String customInstructions, SnapshotResponse snapshot, Instant createdAt, Instant updatedAt
) {}
