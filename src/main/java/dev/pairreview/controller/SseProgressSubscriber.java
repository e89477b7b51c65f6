package dev.pairreview.controller;

import dev.pairreview.analysis.progress.ProgressStatus;
import dev.pairreview.analysis.progress.ProgressSubscriber;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Forwards progress snapshots to an SSE client as {@code progress} events and completes the
 * stream once the run is terminal. A failed send propagates so the broadcaster detaches it.
 */
class SseProgressSubscriber implements ProgressSubscriber {

    static final String EVENT_NAME = "progress";

    private final SseEmitter emitter;

    SseProgressSubscriber(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void onProgress(ProgressStatus status) {
        try {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(status));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (status.status().isTerminal()) {
            emitter.complete();
        }
    }

    @Override
    public void onClose() {
        emitter.complete();
    }
}
