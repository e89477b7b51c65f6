package dev.pairreview.dto.response;

import dev.pairreview.domain.enums.RunStatus;

import java.util.UUID;

public record AnalysisStartedResponse(UUID runId, long reviewId, RunStatus status, int voices) {}
