package dev.pairreview.dto.response;

import dev.pairreview.domain.enums.CommentSource;
import dev.pairreview.domain.enums.CommentStatus;
import dev.pairreview.domain.enums.Side;

import java.time.Instant;
import java.util.UUID;

public record CommentResponse(
        long id, long reviewId, CommentSource source, String author,
        UUID runId, Integer level, Double confidence, String voiceId,
        String file, Integer lineStart, Integer lineEnd, Side side, boolean fileLevel,
        String type, String title, String body, String reasoning,
        CommentStatus status, Long parentId, Long adoptedAsId,
        Instant createdAt, Instant updatedAt
) {}
