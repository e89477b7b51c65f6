package dev.pairreview.repository;

import dev.pairreview.domain.entity.AnalysisRun;
import dev.pairreview.domain.enums.RunStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AnalysisRunRepository extends JpaRepository<AnalysisRun, UUID> {

    /**
     * Display order: most recent activity first; on a tie a top-level run sorts above a child,
     * so a council parent completing in the same second as its child is still listed first.
     */
    String DISPLAY_ORDER = """
             order by coalesce(r.completedAt, r.startedAt) desc,
                      case when r.parentRunId is null then 0 else 1 end asc,
                      r.startedAt desc,
                      r.id desc""";

    @Query("select r from AnalysisRun r where r.reviewId = :reviewId" + DISPLAY_ORDER)
    List<AnalysisRun> findByReviewIdInDisplayOrder(@Param("reviewId") long reviewId);

    @Query("select r from AnalysisRun r where r.reviewId = :reviewId" + DISPLAY_ORDER)
    List<AnalysisRun> findByReviewIdInDisplayOrder(@Param("reviewId") long reviewId, Pageable page);

    List<AnalysisRun> findByParentRunIdOrderByStartedAtAsc(UUID parentRunId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from AnalysisRun r where r.id = :id")
    Optional<AnalysisRun> findByIdForUpdate(@Param("id") UUID id);

    /** Forces RUNNING rows started before {@code cutoff} into FAILED. */
    @Modifying
    @Query("""
            update AnalysisRun r
               set r.status = :failed, r.completedAt = :now, r.errorMessage = :reason
             where r.status = :running and r.startedAt < :cutoff""")
    int failRunsStartedBefore(@Param("cutoff") Instant cutoff,
                              @Param("now") Instant now,
                              @Param("reason") String reason,
                              @Param("running") RunStatus running,
                              @Param("failed") RunStatus failed);

    @Modifying
    @Query("delete from AnalysisRun r where r.reviewId = :reviewId")
    int deleteByReviewId(@Param("reviewId") long reviewId);
}
