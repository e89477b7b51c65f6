package dev.pairreview.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * An isolated checkout of a pull request, owned by the worktree manager.
 */
@Entity
@Table(name = "worktrees", indexes = {
        @Index(name = "idx_worktrees_last_accessed", columnList = "last_accessed_at")
})
public class Worktree {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false)
    private String repository;

    @Column(name = "pr_number", nullable = false)
    private Integer prNumber;

    @Column(name = "source_path", nullable = false, length = 1024)
    private String sourcePath;

    @Column(nullable = false, length = 1024)
    private String path;

    @Column(name = "head_sha", length = 64)
    private String headSha;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    protected Worktree() {
    }

    public static Worktree create(UUID id, String repository, int prNumber, String sourcePath,
            String path, String headSha, Instant now) {
        Worktree w = new Worktree();
        w.id = id;
        w.repository = repository;
        w.prNumber = prNumber;
        w.sourcePath = sourcePath;
        w.path = path;
        w.headSha = headSha;
        w.createdAt = now;
        w.lastAccessedAt = now;
        return w;
    }

    public void markAccessed(String newHeadSha, Instant now) {
        this.headSha = newHeadSha;
        this.lastAccessedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public String getRepository() {
        return repository;
    }

    public Integer getPrNumber() {
        return prNumber;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public String getPath() {
        return path;
    }

    public String getHeadSha() {
        return headSha;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }
}
