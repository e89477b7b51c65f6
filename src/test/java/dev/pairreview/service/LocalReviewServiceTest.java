package dev.pairreview.service;

import dev.pairreview.domain.entity.Review;
import dev.pairreview.dto.response.StalenessResponse;
import dev.pairreview.repository.DiffSnapshotRepository;
import dev.pairreview.repository.ReviewRepository;
import dev.pairreview.snapshot.DiffSnapshotProvider;
import dev.pairreview.snapshot.GitCommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LocalReviewServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private DiffSnapshotRepository snapshotRepository;
    private ReviewService reviewService;
    private DiffSnapshotProvider snapshotProvider;
    private LocalReviewService service;

    @BeforeEach
    void setUp() {
        snapshotRepository = mock(DiffSnapshotRepository.class);
        reviewService = mock(ReviewService.class);
        snapshotProvider = mock(DiffSnapshotProvider.class);
        service = new LocalReviewService(mock(ReviewRepository.class), snapshotRepository, reviewService,
                snapshotProvider, mock(GitCommandRunner.class), new TimeSource(Clock.systemUTC()));
    }

    @ParameterizedTest
    @CsvSource({
            "git@github.com:acme/shop.git, acme/shop",
            "https://github.com/acme/shop, acme/shop",
            "https://github.com/acme/shop.git/, acme/shop",
            "ssh://git@gitlab.example.com:2222/team/api.git, team/api"
    })
    void parsesRemoteUrls(String url, String expected) {
        assertThat(LocalReviewService.parseRemote(url)).isEqualTo(expected);
    }

    @Test
    void unparseableRemote() {
        assertThat(LocalReviewService.parseRemote("")).isNull();
        assertThat(LocalReviewService.parseRemote("shop")).isNull();
    }

    @Test
    @DisplayName("a vanished working copy reads as stale with an explanation")
    void missingPathIsStale(@TempDir Path dir) {
        Path gone = dir.resolve("deleted");
        when(reviewService.require(1L)).thenReturn(Review.createLocal("acme/shop", gone.toString(), "abc", NOW));
        when(snapshotRepository.findById(1L)).thenReturn(Optional.empty());

        StalenessResponse response = service.checkStale(1L);

        assertThat(response.stale()).isTrue();
        assertThat(response.error()).startsWith("Local path not found");
        verify(snapshotProvider, never()).isStale(any(), any());
    }

    @Test
    @DisplayName("without a stored digest the review is stale")
    void missingDigestIsStale(@TempDir Path dir) {
        when(reviewService.require(1L)).thenReturn(Review.createLocal("acme/shop", dir.toString(), "abc", NOW));
        when(snapshotRepository.findById(1L)).thenReturn(Optional.empty());

        StalenessResponse response = service.checkStale(1L);

        assertThat(response.stale()).isTrue();
        assertThat(response.error()).isEqualTo("No stored digest");
    }

    @Test
    void rejectsPullRequestReviews() {
        when(reviewService.require(1L)).thenReturn(Review.createPullRequest("acme/shop", 3, "base", "head", NOW));

        assertThatThrownBy(() -> service.checkStale(1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Review 1 is not a local review");
    }

    @Test
    void rejectsMissingDirectory(@TempDir Path dir) {
        assertThatThrownBy(() -> service.openLocalReview(dir.resolve("nope")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Not a directory");
    }
}
