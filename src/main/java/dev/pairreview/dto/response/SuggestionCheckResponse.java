package dev.pairreview.dto.response;

import java.util.UUID;

/**
 * Whether a review has AI output yet. {@code runId} is the run the summary and stats describe.
 */
public record SuggestionCheckResponse(boolean hasSuggestions, boolean analysisHasRun, UUID runId,
                                      String summary, Stats stats) {

    public record Stats(long issues, long suggestions, long praise) {
        public static Stats empty() {
            return new Stats(0, 0, 0);
        }
    }
}
