package dev.pairreview.repository;

import dev.pairreview.domain.entity.Review;
import dev.pairreview.domain.enums.ReviewKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ReviewRepository extends JpaRepository<Review, Long> {

    Optional<Review> findByKindAndRepositoryAndPrNumber(ReviewKind kind, String repository, Integer prNumber);

    Optional<Review> findByKindAndLocalPathAndLocalHeadSha(ReviewKind kind, String localPath, String localHeadSha);
}
