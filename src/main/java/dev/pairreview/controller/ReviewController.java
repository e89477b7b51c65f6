package dev.pairreview.controller;

import dev.pairreview.dto.request.InstructionsRequest;
import dev.pairreview.dto.request.PullRequestReviewRequest;
import dev.pairreview.dto.response.CommentResponse;
import dev.pairreview.dto.response.ReviewResponse;
import dev.pairreview.dto.response.SuggestionCheckResponse;
import dev.pairreview.service.ReviewService;
import dev.pairreview.service.SuggestionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class ReviewController {

    private final ReviewService reviewService;
    private final SuggestionService suggestionService;

    public ReviewController(ReviewService reviewService, SuggestionService suggestionService) {
        this.reviewService = reviewService;
        this.suggestionService = suggestionService;
    }

    @PostMapping("/pr/reviews")
    public ResponseEntity<ReviewResponse> openPullRequest(@Valid @RequestBody PullRequestReviewRequest request) {
        ReviewResponse review = reviewService.openPullRequestReview(request.repository(), request.prNumber(),
                Path.of(request.sourceRepoPath()), request.baseSha(), request.headSha());
        return ResponseEntity.status(HttpStatus.CREATED).body(review);
    }

    @GetMapping("/reviews/{reviewId}")
    public ReviewResponse getReview(@PathVariable long reviewId) {
        return reviewService.getReview(reviewId);
    }

    @GetMapping("/reviews/{reviewId}/suggestions")
    public List<CommentResponse> suggestions(@PathVariable long reviewId,
                                             @RequestParam(defaultValue = "final") String levels,
                                             @RequestParam(required = false) UUID runId) {
        return suggestionService.getSuggestions(reviewId, levels, runId);
    }

    @GetMapping("/reviews/{reviewId}/suggestions/check")
    public SuggestionCheckResponse check(@PathVariable long reviewId,
                                         @RequestParam(required = false) UUID runId) {
        return suggestionService.checkSuggestions(reviewId, runId);
    }

    @DeleteMapping("/reviews/{reviewId}/suggestions")
    public Map<String, Integer> deleteSuggestions(@PathVariable long reviewId) {
        return Map.of("deleted", suggestionService.deleteAiSuggestions(reviewId));
    }

    @DeleteMapping("/reviews/{reviewId}/comments")
    public Map<String, Integer> deleteUserComments(@PathVariable long reviewId) {
        return Map.of("deleted", suggestionService.bulkDeleteUserComments(reviewId));
    }

    @PutMapping("/reviews/{reviewId}/instructions")
    public ReviewResponse updateInstructions(@PathVariable long reviewId,
                                             @Valid @RequestBody InstructionsRequest request) {
        return reviewService.updateInstructions(reviewId, request.instructions());
    }

    @PostMapping("/reviews/{reviewId}/submit")
    public ReviewResponse submit(@PathVariable long reviewId) {
        return reviewService.markSubmitted(reviewId);
    }
}
