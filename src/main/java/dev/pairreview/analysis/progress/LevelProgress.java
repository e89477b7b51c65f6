package dev.pairreview.analysis.progress;

import dev.pairreview.domain.enums.LevelState;

public record LevelProgress(LevelState state, String message) {

    public static LevelProgress pending() {
        return new LevelProgress(LevelState.PENDING, null);
    }
}
