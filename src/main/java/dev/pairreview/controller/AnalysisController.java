package dev.pairreview.controller;

import dev.pairreview.analysis.orchestrator.AnalysisOrchestrator;
import dev.pairreview.analysis.progress.ActiveRunRegistry;
import dev.pairreview.analysis.progress.ProgressBroadcaster;
import dev.pairreview.domain.entity.AnalysisRun;
import dev.pairreview.dto.request.AnalysisRequest;
import dev.pairreview.dto.request.CouncilAnalysisRequest;
import dev.pairreview.dto.response.AnalysisRunResponse;
import dev.pairreview.dto.response.AnalysisStartedResponse;
import dev.pairreview.dto.response.AnalysisStatusResponse;
import dev.pairreview.dto.response.CancelResponse;
import dev.pairreview.service.AnalysisRunService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Starting, observing and cancelling analyses. Start returns 202 with the run id; the work
 * continues in the background and is followed through the status or events endpoints.
 */
@RestController
@RequestMapping("/api")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisOrchestrator orchestrator;
    private final AnalysisRunService runService;
    private final ProgressBroadcaster broadcaster;
    private final ActiveRunRegistry registry;

    public AnalysisController(AnalysisOrchestrator orchestrator, AnalysisRunService runService,
                              ProgressBroadcaster broadcaster, ActiveRunRegistry registry) {
        this.orchestrator = orchestrator;
        this.runService = runService;
        this.broadcaster = broadcaster;
        this.registry = registry;
    }

    @PostMapping("/reviews/{reviewId}/analyses")
    public ResponseEntity<AnalysisStartedResponse> start(@PathVariable long reviewId,
                                                         @RequestBody(required = false) AnalysisRequest request) {
        AnalysisRequest effective = request != null ? request : new AnalysisRequest(null, null, null, null, null, null);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.startSingle(reviewId, effective));
    }

    @PostMapping("/reviews/{reviewId}/analyses/council")
    public ResponseEntity<AnalysisStartedResponse> startCouncil(@PathVariable long reviewId,
                                                                @Valid @RequestBody CouncilAnalysisRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(orchestrator.startCouncil(reviewId, request.config(), request.instructions()));
    }

    @GetMapping("/reviews/{reviewId}/analyses")
    public List<AnalysisRunResponse> listRuns(@PathVariable long reviewId) {
        return runService.getByReviewId(reviewId).stream().map(AnalysisRunResponse::from).toList();
    }

    /** Clears the run history of a review. Refused while an analysis of it is still running. */
    @DeleteMapping("/reviews/{reviewId}/analyses")
    public ResponseEntity<Void> deleteRuns(@PathVariable long reviewId) {
        registry.findRunningByReview(reviewId).ifPresent(active -> {
            throw new IllegalStateException("Analysis " + active.getRunId() + " is still running for review " + reviewId);
        });
        runService.deleteByReviewId(reviewId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/analyses/{runId}")
    public AnalysisStatusResponse status(@PathVariable UUID runId) {
        return orchestrator.getStatus(runId);
    }

    @PostMapping("/analyses/{runId}/cancel")
    public CancelResponse cancel(@PathVariable UUID runId) {
        return orchestrator.cancel(runId);
    }

    /**
     * Progress stream. A run this process no longer tracks gets its stored state as a single
     * {@code run} event and the stream ends.
     */
    @GetMapping(path = "/analyses/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable UUID runId) throws IOException {
        AnalysisRun run = runService.require(runId);
        SseEmitter emitter = new SseEmitter(0L);

        Optional<ProgressBroadcaster.Subscription> attached =
                broadcaster.subscribe(runId, new SseProgressSubscriber(emitter));
        if (attached.isEmpty()) {
            // not executing here, or its stream was pruned: answer with the stored row
            emitter.send(SseEmitter.event().name("run").data(AnalysisRunResponse.from(run)));
            emitter.complete();
            return emitter;
        }

        ProgressBroadcaster.Subscription subscription = attached.get();
        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(e -> {
            log.debug("Progress stream of run {} ended: {}", runId, e.getMessage());
            subscription.cancel();
        });
        return emitter;
    }
}
