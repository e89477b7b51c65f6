package dev.pairreview.domain.enums;

/** Per-level progress state, reported while a run is tracked. */
public enum LevelState {
    PENDING, RUNNING, COMPLETED, SKIPPED, FAILED, CANCELLED;

    public boolean isSettled() {
        return this != PENDING && this != RUNNING;
    }
}
