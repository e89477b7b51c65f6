package dev.pairreview.domain.entity;

import dev.pairreview.domain.valueobject.DiffStats;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * The live diff for a review. One row per review; a refresh overwrites it in place.
 * The digest is fixed at capture time and only compared, never recomputed on read.
 */
@Entity
@Table(name = "diff_snapshots")
public class DiffSnapshot {

    @Id
    @Column(name = "review_id")
    private Long reviewId;

    @Column(name = "diff_text", columnDefinition = "text", nullable = false)
    private String diffText;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private DiffStats stats;

    @Column(length = 16)
    private String digest;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    protected DiffSnapshot() {
    }

    public static DiffSnapshot of(long reviewId, String diffText, DiffStats stats, String digest, Instant now) {
        DiffSnapshot s = new DiffSnapshot();
        s.reviewId = reviewId;
        s.replace(diffText, stats, digest, now);
        return s;
    }

    public void replace(String newDiffText, DiffStats newStats, String newDigest, Instant now) {
        this.diffText = newDiffText == null ? "" : newDiffText;
        this.stats = newStats == null ? DiffStats.empty() : newStats;
        this.digest = newDigest;
        this.capturedAt = now;
    }

    public Long getReviewId() {
        return reviewId;
    }

    public String getDiffText() {
        return diffText;
    }

    public DiffStats getStats() {
        return stats;
    }

    public String getDigest() {
        return digest;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }
}
