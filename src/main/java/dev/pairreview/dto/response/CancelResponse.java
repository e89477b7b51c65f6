package dev.pairreview.dto.response;

import dev.pairreview.domain.enums.RunStatus;

import java.util.UUID;

/**
 * @param cancelled true when this request moved the run to CANCELLED; false when it was already terminal
 */
public record CancelResponse(UUID runId, RunStatus status, boolean cancelled) {}
