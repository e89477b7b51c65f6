package dev.pairreview.service;

import dev.pairreview.analysis.AnalysisInput;
import dev.pairreview.domain.entity.Comment;
import dev.pairreview.domain.entity.DiffSnapshot;
import dev.pairreview.domain.entity.Review;
import dev.pairreview.domain.entity.Worktree;
import dev.pairreview.domain.enums.CommentSource;
import dev.pairreview.domain.enums.CommentStatus;
import dev.pairreview.domain.enums.ReviewKind;
import dev.pairreview.domain.valueobject.RunInstructions;
import dev.pairreview.dto.response.ReviewResponse;
import dev.pairreview.dto.response.SnapshotResponse;
import dev.pairreview.exception.ResourceNotFoundException;
import dev.pairreview.repository.CommentRepository;
import dev.pairreview.repository.DiffSnapshotRepository;
import dev.pairreview.repository.ReviewRepository;
import dev.pairreview.repository.WorktreeRepository;
import dev.pairreview.snapshot.CapturedDiff;
import dev.pairreview.snapshot.DiffSnapshotProvider;
import dev.pairreview.worktree.WorktreeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Pull request reviews and the review-level state shared by both kinds: summary, submission and
 * the input handed to an analysis.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewRepository reviewRepository;
    private final DiffSnapshotRepository snapshotRepository;
    private final WorktreeRepository worktreeRepository;
    private final CommentRepository commentRepository;
    private final WorktreeManager worktreeManager;
    private final DiffSnapshotProvider snapshotProvider;
    private final TimeSource time;

    public ReviewService(ReviewRepository reviewRepository, DiffSnapshotRepository snapshotRepository,
                         WorktreeRepository worktreeRepository, CommentRepository commentRepository,
                         WorktreeManager worktreeManager, DiffSnapshotProvider snapshotProvider, TimeSource time) {
        this.reviewRepository = reviewRepository;
        this.snapshotRepository = snapshotRepository;
        this.worktreeRepository = worktreeRepository;
        this.commentRepository = commentRepository;
        this.worktreeManager = worktreeManager;
        this.snapshotProvider = snapshotProvider;
        this.time = time;
    }

    /**
     * Gets or creates the review of a pull request, checks its head out in a worktree and stores
     * the {@code base...head} diff as its snapshot.
     */
    @Transactional
    public ReviewResponse openPullRequestReview(String repository, int prNumber, Path sourceRepoPath,
                                                String baseSha, String headSha) {
        Instant now = time.now();
        Review review = reviewRepository.findByKindAndRepositoryAndPrNumber(ReviewKind.PR, repository, prNumber)
                .map(existing -> {
                    existing.moveHead(baseSha, headSha, now);
                    return existing;
                })
                .orElseGet(() -> reviewRepository.save(
                        Review.createPullRequest(repository, prNumber, baseSha, headSha, now)));

        Worktree worktree = worktreeManager.acquire(repository, prNumber, sourceRepoPath, headSha);
        CapturedDiff captured = snapshotProvider.captureRange(Path.of(worktree.getPath()), baseSha, headSha);
        DiffSnapshot snapshot = storeSnapshot(review.getId(), captured, now);
        log.info("Opened review {} for {}#{} at {}", review.getId(), repository, prNumber, headSha);
        return toResponse(review, snapshot);
    }

    @Transactional(readOnly = true)
    public ReviewResponse getReview(long reviewId) {
        Review review = require(reviewId);
        return toResponse(review, snapshotRepository.findById(reviewId).orElse(null));
    }

    /**
     * Everything an analysis needs, detached from the session. Fails when the review has no
     * snapshot yet or its checkout is missing.
     */
    @Transactional(readOnly = true)
    public AnalysisInput loadAnalysisInput(long reviewId, String requestInstructions) {
        Review review = require(reviewId);
        DiffSnapshot snapshot = snapshotRepository.findById(reviewId)
                .orElseThrow(() -> new IllegalStateException(
                        "Review %d has no diff snapshot; open or refresh it first".formatted(reviewId)));
        Path workingDirectory = review.isLocal()
                ? Path.of(review.getLocalPath())
                : worktreeRepository.findByRepositoryAndPrNumber(review.getRepository(), review.getPrNumber())
                        .map(w -> Path.of(w.getPath()))
                        .orElseThrow(() -> new IllegalStateException(
                                "Review %d has no worktree; reopen the pull request".formatted(reviewId)));

        return new AnalysisInput(reviewId, review.getRepository(), review.currentHeadSha(), workingDirectory,
                snapshot.getDiffText(), snapshot.getStats().reviewablePaths(),
                new RunInstructions(review.getCustomInstructions(), requestInstructions));
    }

    @Transactional
    public void updateSummary(long reviewId, String summary) {
        require(reviewId).updateSummary(summary, time.now());
    }

    @Transactional
    public ReviewResponse updateInstructions(long reviewId, String instructions) {
        Review review = require(reviewId);
        review.updateInstructions(instructions == null || instructions.isBlank() ? null : instructions.strip(),
                time.now());
        log.info("Updated instructions of review {}", reviewId);
        return toResponse(review, snapshotRepository.findById(reviewId).orElse(null));
    }

    /** Marks the review and every draft or active user comment as submitted. */
    @Transactional
    public ReviewResponse markSubmitted(long reviewId) {
        Instant now = time.now();
        Review review = require(reviewId);
        review.markSubmitted(now);
        List<Comment> pending = commentRepository.findByReviewIdAndSourceAndStatusIn(reviewId, CommentSource.USER,
                List.of(CommentStatus.DRAFT, CommentStatus.ACTIVE));
        pending.forEach(c -> c.markSubmitted(now));
        log.info("Submitted review {} with {} comments", reviewId, pending.size());
        return toResponse(review, snapshotRepository.findById(reviewId).orElse(null));
    }

    public Review require(long reviewId) {
        return reviewRepository.findById(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("Review", reviewId));
    }

    public DiffSnapshot storeSnapshot(long reviewId, CapturedDiff captured, Instant now) {
        return snapshotRepository.findById(reviewId)
                .map(existing -> {
                    existing.replace(captured.diffText(), captured.stats(), captured.digest(), now);
                    return existing;
                })
                .orElseGet(() -> snapshotRepository.save(
                        DiffSnapshot.of(reviewId, captured.diffText(), captured.stats(), captured.digest(), now)));
    }

    static ReviewResponse toResponse(Review r, DiffSnapshot snapshot) {
        return new ReviewResponse(r.getId(), r.getRepository(), r.getKind(), r.getStatus(),
                r.getPrNumber(), r.getBaseSha(), r.currentHeadSha(), r.getLocalPath(),
                r.getSummary(), r.getCustomInstructions(), snapshot == null ? null : toResponse(snapshot),
                r.getCreatedAt(), r.getUpdatedAt());
    }

    static SnapshotResponse toResponse(DiffSnapshot s) {
        return new SnapshotResponse(s.getReviewId(), s.getDigest(), s.getStats(), s.getCapturedAt());
    }
}
