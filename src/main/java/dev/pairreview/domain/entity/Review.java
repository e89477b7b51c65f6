package dev.pairreview.domain.entity;

import dev.pairreview.domain.enums.ReviewKind;
import dev.pairreview.domain.enums.ReviewStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * A reviewable unit of change: a pull request or a local working-copy session.
 * Created on first open and never deleted automatically.
 */
@Entity
@Table(name = "reviews", indexes = {
        @Index(name = "idx_reviews_repo_pr", columnList = "repository, pr_number"),
        @Index(name = "idx_reviews_local", columnList = "local_path, local_head_sha")
})
public class Review {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String repository;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_kind", nullable = false, length = 16)
    private ReviewKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ReviewStatus status;

    @Column(name = "pr_number")
    private Integer prNumber;

    @Column(name = "base_sha", length = 64)
    private String baseSha;

    @Column(name = "head_sha", length = 64)
    private String headSha;

    @Column(name = "local_path", length = 1024)
    private String localPath;

    @Column(name = "local_head_sha", length = 64)
    private String localHeadSha;

    @Column(name = "custom_instructions", columnDefinition = "text")
    private String customInstructions;

    @Column(columnDefinition = "text")
    private String summary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Review() {
    }

    public static Review createPullRequest(String repository, int prNumber, String baseSha,
            String headSha, Instant now) {
        Review r = base(repository, ReviewKind.PR, now);
        r.prNumber = prNumber;
        r.baseSha = baseSha;
        r.headSha = headSha;
        return r;
    }

    public static Review createLocal(String repository, String localPath, String localHeadSha, Instant now) {
        Review r = base(repository, ReviewKind.LOCAL, now);
        r.localPath = localPath;
        r.localHeadSha = localHeadSha;
        return r;
    }

    private static Review base(String repository, ReviewKind kind, Instant now) {
        if (repository == null || repository.isBlank())
            throw new IllegalArgumentException("repository is required");
        Review r = new Review();
        r.repository = repository;
        r.kind = kind;
        r.status = ReviewStatus.DRAFT;
        r.createdAt = now;
        r.updatedAt = now;
        return r;
    }

    public void moveHead(String newBaseSha, String newHeadSha, Instant now) {
        this.baseSha = newBaseSha;
        this.headSha = newHeadSha;
        touch(now);
    }

    public void updateSummary(String newSummary, Instant now) {
        this.summary = newSummary;
        touch(now);
    }

    public void updateInstructions(String instructions, Instant now) {
        this.customInstructions = instructions;
        touch(now);
    }

    public void markSubmitted(Instant now) {
        if (status == ReviewStatus.SUBMITTED)
            throw new IllegalStateException("Review %d is already submitted".formatted(id));
        this.status = ReviewStatus.SUBMITTED;
        touch(now);
    }

    public boolean isLocal() {
        return kind == ReviewKind.LOCAL;
    }

    /** Commit the review currently points at, whichever kind it is. */
    public String currentHeadSha() {
        return isLocal() ? localHeadSha : headSha;
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }

    // Getters
    public Long getId() {
        return id;
    }

    public String getRepository() {
        return repository;
    }

    public ReviewKind getKind() {
        return kind;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Integer getPrNumber() {
        return prNumber;
    }

    public String getBaseSha() {
        return baseSha;
    }

    public String getHeadSha() {
        return headSha;
    }

    public String getLocalPath() {
        return localPath;
    }

    public String getLocalHeadSha() {
        return localHeadSha;
    }

    public String getCustomInstructions() {
        return customInstructions;
    }

    public String getSummary() {
        return summary;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
