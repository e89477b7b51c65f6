package dev.pairreview.analysis.pipeline;

import dev.pairreview.domain.valueobject.RunUpdate;
import dev.pairreview.domain.valueobject.SuggestionDraft;

import java.util.List;

/**
 * How a pipeline ended. Cancellation is an outcome, not an error.
 */
public record PipelineOutcome(Kind kind, List<SuggestionDraft> suggestions, String summary,
                              String failureReason) {

    public enum Kind { COMPLETED, FAILED, CANCELLED }

    public PipelineOutcome {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static PipelineOutcome completed(List<SuggestionDraft> suggestions, String summary) {
        return new PipelineOutcome(Kind.COMPLETED, suggestions, summary, null);
    }

    public static PipelineOutcome failed(String reason) {
        return new PipelineOutcome(Kind.FAILED, List.of(), null, reason);
    }

    public static PipelineOutcome cancelled() {
        return new PipelineOutcome(Kind.CANCELLED, List.of(), null, null);
    }

    public boolean isCompleted() {
        return kind == Kind.COMPLETED;
    }

    public RunUpdate toRunUpdate() {
        return switch (kind) {
            case COMPLETED -> RunUpdate.completed(summary, suggestions.size());
            case FAILED -> RunUpdate.failed(failureReason);
            case CANCELLED -> RunUpdate.cancelled();
        };
    }
}
