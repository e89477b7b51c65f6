package dev.pairreview.domain.enums;

/**
 * Lifecycle: RUNNING → COMPLETED | FAILED | CANCELLED. Terminal states are final.
 */
public enum RunStatus {
    RUNNING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
