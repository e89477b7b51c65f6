package dev.pairreview.analysis.progress;

import dev.pairreview.config.AnalysisProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans progress snapshots of a run out to any number of subscribers.
 *
 * <p>Each subscriber owns a bounded buffer drained on the dispatch executor; when it is full the
 * oldest snapshot is dropped, so publishing never blocks. A new subscriber immediately receives the
 * latest snapshot of the run. Subscribing is only possible between {@link #open} and {@link #close}.
 */
@Component
public class ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    private final Map<UUID, Set<BufferedSubscriber>> subscribers = new ConcurrentHashMap<>();
    private final Map<UUID, ProgressStatus> latest = new ConcurrentHashMap<>();
    private final Executor dispatchExecutor;
    private final int bufferSize;

    public ProgressBroadcaster(@Qualifier("progressDispatchExecutor") Executor dispatchExecutor,
                               AnalysisProperties properties) {
        this.dispatchExecutor = dispatchExecutor;
        this.bufferSize = properties.subscriberBuffer();
    }

    public void publish(ProgressStatus status) {
        latest.put(status.runId(), status);
        Set<BufferedSubscriber> targets = subscribers.get(status.runId());
        if (targets == null) return;
        for (BufferedSubscriber subscriber : targets) {
            subscriber.offer(status);
        }
    }

    /** Starts accepting subscribers for a run. Opening an open run is a no-op. */
    public synchronized void open(UUID runId) {
        subscribers.putIfAbsent(runId, ConcurrentHashMap.newKeySet());
    }

    /**
     * Attaches a subscriber to an open run.
     *
     * @return empty when the run was never opened here or its stream is already closed
     */
    public synchronized Optional<Subscription> subscribe(UUID runId, ProgressSubscriber delegate) {
        Set<BufferedSubscriber> set = subscribers.get(runId);
        if (set == null) return Optional.empty();
        BufferedSubscriber subscriber = new BufferedSubscriber(runId, delegate);
        set.add(subscriber);
        ProgressStatus current = latest.get(runId);
        if (current != null) {
            subscriber.offer(current);
        }
        log.debug("Subscriber attached to run {} ({} total)", runId, set.size());
        return Optional.of(() -> detach(subscriber));
    }

    /** Ends the stream of one run: every subscriber is detached and notified. */
    public synchronized void close(UUID runId) {
        latest.remove(runId);
        Set<BufferedSubscriber> removed = subscribers.remove(runId);
        if (removed != null) {
            removed.forEach(BufferedSubscriber::close);
        }
    }

    @PreDestroy
    public void closeAll() {
        List<UUID> runIds = List.copyOf(subscribers.keySet());
        runIds.forEach(this::close);
        latest.clear();
        if (!runIds.isEmpty()) {
            log.info("Closed progress streams of {} run(s)", runIds.size());
        }
    }

    public int subscriberCount(UUID runId) {
        Set<BufferedSubscriber> set = subscribers.get(runId);
        return set == null ? 0 : set.size();
    }

    private void detach(BufferedSubscriber subscriber) {
        Set<BufferedSubscriber> set = subscribers.get(subscriber.runId);
        if (set != null && set.remove(subscriber)) {
            subscriber.close();
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    private final class BufferedSubscriber {
        private final UUID runId;
        private final ProgressSubscriber delegate;
        private final Deque<ProgressStatus> buffer = new ArrayDeque<>();
        private boolean draining;
        private boolean closed;
        private long dropped;

        BufferedSubscriber(UUID runId, ProgressSubscriber delegate) {
            this.runId = runId;
            this.delegate = delegate;
        }

        void offer(ProgressStatus status) {
            synchronized (this) {
                if (closed) return;
                if (buffer.size() >= bufferSize) {
                    buffer.pollFirst();
                    if (++dropped % 100 == 1) {
                        log.debug("Subscriber of run {} is slow; dropped {} snapshot(s)", runId, dropped);
                    }
                }
                buffer.addLast(status);
                if (draining) return;
                draining = true;
            }
            try {
                dispatchExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                synchronized (this) {
                    draining = false;
                }
                log.warn("Progress dispatch rejected for run {}: {}", runId, e.getMessage());
            }
        }

        void drain() {
            while (true) {
                ProgressStatus next;
                synchronized (this) {
                    next = closed ? null : buffer.pollFirst();
                    if (next == null) {
                        draining = false;
                        return;
                    }
                }
                try {
                    delegate.onProgress(next);
                } catch (RuntimeException e) {
                    log.debug("Detaching subscriber of run {}: {}", runId, e.getMessage());
                    synchronized (this) {
                        draining = false;
                    }
                    detach(this);
                    return;
                }
            }
        }

        void close() {
            synchronized (this) {
                if (closed) return;
                closed = true;
                buffer.clear();
            }
            try {
                delegate.onClose();
            } catch (RuntimeException e) {
                log.debug("Subscriber of run {} failed on close: {}", runId, e.getMessage());
            }
        }
    }
}
