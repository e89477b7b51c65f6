package dev.pairreview.dto.request;

import dev.pairreview.domain.enums.CommentStatus;
import jakarta.validation.constraints.NotNull;

public record StatusUpdateRequest(@NotNull CommentStatus status) {}
