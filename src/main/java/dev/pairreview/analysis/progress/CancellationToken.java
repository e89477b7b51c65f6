package dev.pairreview.analysis.progress;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by a run and all of its voices. Workers poll it at
 * checkpoints; nothing is interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** @return true if this call performed the cancellation */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
