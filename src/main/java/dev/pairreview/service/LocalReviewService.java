package dev.pairreview.service;

import dev.pairreview.domain.entity.DiffSnapshot;
import dev.pairreview.domain.entity.Review;
import dev.pairreview.domain.enums.ReviewKind;
import dev.pairreview.dto.response.ReviewResponse;
import dev.pairreview.dto.response.SnapshotResponse;
import dev.pairreview.dto.response.StalenessResponse;
import dev.pairreview.repository.DiffSnapshotRepository;
import dev.pairreview.repository.ReviewRepository;
import dev.pairreview.snapshot.CapturedDiff;
import dev.pairreview.snapshot.DiffSnapshotProvider;
import dev.pairreview.snapshot.GitCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

/**
 * Reviews of uncommitted work in a local checkout. A review is keyed by (git root, HEAD), so a new
 * commit starts a new review while edits on top of the same HEAD refresh the existing one.
 */
@Service
public class LocalReviewService {

    private static final Logger log = LoggerFactory.getLogger(LocalReviewService.class);

    private final ReviewRepository reviewRepository;
    private final DiffSnapshotRepository snapshotRepository;
    private final ReviewService reviewService;
    private final DiffSnapshotProvider snapshotProvider;
    private final GitCommandRunner git;
    private final TimeSource time;

    public LocalReviewService(ReviewRepository reviewRepository, DiffSnapshotRepository snapshotRepository,
                              ReviewService reviewService, DiffSnapshotProvider snapshotProvider,
                              GitCommandRunner git, TimeSource time) {
        this.reviewRepository = reviewRepository;
        this.snapshotRepository = snapshotRepository;
        this.reviewService = reviewService;
        this.snapshotProvider = snapshotProvider;
        this.git = git;
        this.time = time;
    }

    @Transactional
    public ReviewResponse openLocalReview(Path path) {
        if (!Files.isDirectory(path))
            throw new IllegalArgumentException("Not a directory: " + path);
        Path root = Path.of(git.output(path, "rev-parse", "--show-toplevel").strip());
        String head = git.output(root, "rev-parse", "HEAD").strip();
        String repository = repositoryName(root);

        Instant now = time.now();
        Review review = reviewRepository
                .findByKindAndLocalPathAndLocalHeadSha(ReviewKind.LOCAL, root.toString(), head)
                .orElseGet(() -> reviewRepository.save(Review.createLocal(repository, root.toString(), head, now)));

        DiffSnapshot snapshot = reviewService.storeSnapshot(review.getId(), snapshotProvider.capture(root), now);
        log.info("Opened local review {} for {} at {}", review.getId(), root, head);
        return ReviewService.toResponse(review, snapshot);
    }

    /** Recaptures the working copy and replaces the stored snapshot. */
    @Transactional
    public SnapshotResponse refreshLocalDiff(long reviewId) {
        Review review = requireLocal(reviewId);
        CapturedDiff captured = snapshotProvider.capture(Path.of(review.getLocalPath()));
        DiffSnapshot snapshot = reviewService.storeSnapshot(reviewId, captured, time.now());
        log.info("Refreshed diff of review {} (digest {})", reviewId, captured.digest());
        return ReviewService.toResponse(snapshot);
    }

    /** Compares the stored digest with the working copy. Never fails; problems read as stale. */
    @Transactional(readOnly = true)
    public StalenessResponse checkStale(long reviewId) {
        Review review = requireLocal(reviewId);
        String storedDigest = snapshotRepository.findById(reviewId).map(DiffSnapshot::getDigest).orElse(null);
        Path path = Path.of(review.getLocalPath());
        if (!Files.isDirectory(path)) {
            log.warn("Local path {} of review {} no longer exists", path, reviewId);
            return new StalenessResponse(reviewId, true, storedDigest, "Local path not found: " + path);
        }
        if (storedDigest == null) {
            return new StalenessResponse(reviewId, true, null, "No stored digest");
        }
        return new StalenessResponse(reviewId, snapshotProvider.isStale(path, storedDigest), storedDigest, null);
    }

    // ── Internal ───────────────────────────────────────────────────

    private Review requireLocal(long reviewId) {
        Review review = reviewService.require(reviewId);
        if (!review.isLocal())
            throw new IllegalArgumentException("Review %d is not a local review".formatted(reviewId));
        return review;
    }

    /** {@code owner/repo} from the origin remote, or the checkout's directory name. */
    private String repositoryName(Path root) {
        String url = git.run(root, Set.of(0, 1), "config", "--get", "remote.origin.url").stdout().strip();
        String fromRemote = parseRemote(url);
        return fromRemote != null ? fromRemote : root.getFileName().toString();
    }

    static String parseRemote(String url) {
        if (url == null || url.isBlank()) return null;
        String trimmed = url.strip();
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        if (trimmed.endsWith(".git")) trimmed = trimmed.substring(0, trimmed.length() - 4);
        String[] parts = trimmed.split("[/:]");
        if (parts.length < 2) return null;
        String owner = parts[parts.length - 2];
        String name = parts[parts.length - 1];
        if (owner.isBlank() || name.isBlank()) return null;
        return owner + "/" + name;
    }
}
