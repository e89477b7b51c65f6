package dev.pairreview.controller;

import dev.pairreview.dto.request.LocalReviewRequest;
import dev.pairreview.dto.response.ReviewResponse;
import dev.pairreview.dto.response.SnapshotResponse;
import dev.pairreview.dto.response.StalenessResponse;
import dev.pairreview.service.LocalReviewService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;

@RestController
@RequestMapping("/api/local/reviews")
public class LocalReviewController {

    private final LocalReviewService localReviewService;

    public LocalReviewController(LocalReviewService localReviewService) {
        this.localReviewService = localReviewService;
    }

    @PostMapping
    public ResponseEntity<ReviewResponse> open(@Valid @RequestBody LocalReviewRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(localReviewService.openLocalReview(Path.of(request.path())));
    }

    @PostMapping("/{reviewId}/refresh")
    public SnapshotResponse refresh(@PathVariable long reviewId) {
        return localReviewService.refreshLocalDiff(reviewId);
    }

    @GetMapping("/{reviewId}/stale")
    public StalenessResponse stale(@PathVariable long reviewId) {
        return localReviewService.checkStale(reviewId);
    }
}
