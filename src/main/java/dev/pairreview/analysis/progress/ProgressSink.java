package dev.pairreview.analysis.progress;

import dev.pairreview.domain.enums.LevelState;

/**
 * Receives level state changes from a pipeline. Level keys are "1", "2", "3" and {@link #FINAL}.
 */
@FunctionalInterface
public interface ProgressSink {

    String FINAL = "final";

    void level(String levelKey, LevelState state, String message);

    static String levelKey(int level) {
        return String.valueOf(level);
    }
}
