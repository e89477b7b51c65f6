package dev.pairreview.analysis.progress;

/**
 * Listener attached to one run's progress stream. Called from a dispatch thread, never from the
 * publisher's thread. Throwing from {@link #onProgress} detaches the subscriber.
 */
public interface ProgressSubscriber {

    void onProgress(ProgressStatus status);

    /** The stream ended: the run's tracking entry was removed or the server is shutting down. */
    default void onClose() {
    }
}
