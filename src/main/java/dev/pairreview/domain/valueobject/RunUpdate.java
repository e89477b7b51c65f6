package dev.pairreview.domain.valueobject;

import dev.pairreview.domain.enums.RunStatus;

/**
 * Partial update applied to a running analysis run. Null fields are left untouched.
 */
public record RunUpdate(RunStatus status, String summary, Integer totalSuggestions,
                        Integer filesAnalyzed, String errorMessage) {

    public static RunUpdate progress(int filesAnalyzed) {
        return new RunUpdate(null, null, null, filesAnalyzed, null);
    }

    public static RunUpdate completed(String summary, int totalSuggestions) {
        return new RunUpdate(RunStatus.COMPLETED, summary, totalSuggestions, null, null);
    }

    public static RunUpdate failed(String errorMessage) {
        return new RunUpdate(RunStatus.FAILED, null, null, null, errorMessage);
    }

    public static RunUpdate cancelled() {
        return new RunUpdate(RunStatus.CANCELLED, null, null, null, null);
    }
}
