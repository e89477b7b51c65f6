package dev.pairreview.repository;

import dev.pairreview.domain.entity.Comment;
import dev.pairreview.domain.enums.CommentSource;
import dev.pairreview.domain.enums.CommentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommentRepository extends JpaRepository<Comment, Long> {

    /**
     * Non-raw AI suggestions of one run. Final suggestions come first, then levels 1-3;
     * inside a level file-level comments lead, then file and line order.
     */
    @Query("""
            select c from Comment c
             where c.reviewId = :reviewId
               and c.source = dev.pairreview.domain.enums.CommentSource.AI
               and c.raw = false
               and c.aiRunId = :runId
               and c.status in :statuses
               and ((:includeFinal = true and c.aiLevel is null) or c.aiLevel in :levels)
             order by case when c.aiLevel is null then 0 else c.aiLevel end,
                      c.fileLevel desc, c.file, c.lineStart, c.id""")
    List<Comment> findSuggestions(@Param("reviewId") long reviewId,
                                  @Param("runId") UUID runId,
                                  @Param("includeFinal") boolean includeFinal,
                                  @Param("levels") Collection<Integer> levels,
                                  @Param("statuses") Collection<CommentStatus> statuses);

    boolean existsByReviewIdAndSourceAndRawFalse(long reviewId, CommentSource source);

    /** Run id of the most recently written non-raw AI suggestion; pass a one-row page. */
    @Query("""
            select c.aiRunId from Comment c
             where c.reviewId = :reviewId
               and c.source = dev.pairreview.domain.enums.CommentSource.AI
               and c.raw = false
               and c.aiRunId is not null
             order by c.createdAt desc, c.id desc""")
    List<UUID> findLatestSuggestionRunIds(@Param("reviewId") long reviewId, Pageable page);

    @Query("""
            select c.type as type, count(c) as count from Comment c
             where c.reviewId = :reviewId
               and c.source = dev.pairreview.domain.enums.CommentSource.AI
               and c.aiLevel is null
               and c.aiRunId = :runId
             group by c.type""")
    List<TypeCount> countFinalByType(@Param("reviewId") long reviewId, @Param("runId") UUID runId);

    List<Comment> findByReviewIdAndSourceAndStatusIn(long reviewId, CommentSource source,
                                                     Collection<CommentStatus> statuses);

    List<Comment> findByReviewIdAndSource(long reviewId, CommentSource source);

    List<Comment> findByParentIdIn(Collection<Long> parentIds);

    Optional<Comment> findFirstByParentIdAndStatusOrderByIdDesc(long parentId, CommentStatus status);

    interface TypeCount {
        String getType();

        long getCount();
    }
}
