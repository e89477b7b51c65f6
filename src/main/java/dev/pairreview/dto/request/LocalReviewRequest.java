package dev.pairreview.dto.request;

import jakarta.validation.constraints.NotBlank;

public record LocalReviewRequest(@NotBlank String path) {}
