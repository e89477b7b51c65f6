package dev.pairreview.domain.entity;

import dev.pairreview.domain.enums.CommentSource;
import dev.pairreview.domain.enums.CommentStatus;
import dev.pairreview.domain.enums.Side;
import dev.pairreview.domain.valueobject.SuggestionDraft;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A review comment. AI suggestions and user comments share the table; the AI columns
 * ({@code aiRunId}, {@code aiLevel}, {@code aiConfidence}, {@code voiceId}, {@code raw}) are
 * null or false for user comments.
 *
 * <p>A user comment adopted from a suggestion points at it through {@code parentId}; the
 * suggestion points back through {@code adoptedAsId}.
 */
@Entity
@Table(name = "comments", indexes = {
        @Index(name = "idx_comments_review_source", columnList = "review_id, source"),
        @Index(name = "idx_comments_run", columnList = "ai_run_id"),
        @Index(name = "idx_comments_parent", columnList = "parent_id")
})
public class Comment {

    public static final int FILE_LENGTH = 1024;
    public static final int TYPE_LENGTH = 64;
    public static final int TITLE_LENGTH = 512;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "review_id", nullable = false)
    private Long reviewId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private CommentSource source;

    @Column(length = 255)
    private String author;

    @Column(name = "ai_run_id", columnDefinition = "uuid")
    private UUID aiRunId;

    @Column(name = "ai_level")
    private Integer aiLevel;

    @Column(name = "ai_confidence")
    private Double aiConfidence;

    @Column(name = "voice_id")
    private String voiceId;

    @Column(name = "is_raw", nullable = false)
    private boolean raw;

    @Column(nullable = false, length = FILE_LENGTH)
    private String file;

    @Column(name = "line_start")
    private Integer lineStart;

    @Column(name = "line_end")
    private Integer lineEnd;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private Side side;

    @Column(length = TYPE_LENGTH)
    private String type;

    @Column(length = TITLE_LENGTH)
    private String title;

    @Column(columnDefinition = "text", nullable = false)
    private String body;

    @Column(columnDefinition = "text")
    private String reasoning;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CommentStatus status;

    @Column(name = "is_file_level", nullable = false)
    private boolean fileLevel;

    @Column(name = "parent_id")
    private Long parentId;

    @Column(name = "adopted_as_id")
    private Long adoptedAsId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Comment() {
    }

    public static Comment aiSuggestion(long reviewId, UUID runId, SuggestionDraft draft,
            boolean raw, String voiceId, Instant now) {
        Comment c = new Comment();
        c.reviewId = reviewId;
        c.source = CommentSource.AI;
        c.author = "AI Assistant";
        c.aiRunId = runId;
        c.aiLevel = draft.level();
        c.aiConfidence = draft.confidence();
        c.voiceId = voiceId;
        c.raw = raw;
        c.file = draft.file();
        c.lineStart = draft.lineStart();
        c.lineEnd = draft.lineEnd();
        c.side = draft.side();
        c.type = draft.type();
        c.title = draft.title();
        c.body = draft.body() == null ? "" : draft.body();
        c.reasoning = draft.reasoning();
        c.fileLevel = draft.fileLevel();
        c.status = CommentStatus.ACTIVE;
        c.createdAt = now;
        c.updatedAt = now;
        return c;
    }

    /** A user comment created by adopting {@code suggestion}; it starts life as a draft. */
    public static Comment adoptedFrom(Comment suggestion, String body, String author, Instant now) {
        Comment c = new Comment();
        c.reviewId = suggestion.reviewId;
        c.source = CommentSource.USER;
        c.author = author;
        c.parentId = suggestion.id;
        c.file = suggestion.file;
        c.lineStart = suggestion.lineStart;
        c.lineEnd = suggestion.lineEnd;
        c.side = suggestion.side;
        c.type = suggestion.type;
        c.title = suggestion.title;
        c.body = body;
        c.fileLevel = suggestion.fileLevel;
        c.status = CommentStatus.DRAFT;
        c.createdAt = now;
        c.updatedAt = now;
        return c;
    }

    public void dismiss(Instant now) {
        this.status = CommentStatus.DISMISSED;
        touch(now);
    }

    public void restore(Instant now) {
        requireSource(CommentSource.AI);
        this.status = CommentStatus.ACTIVE;
        this.adoptedAsId = null;
        touch(now);
    }

    public void markAdopted(long userCommentId, Instant now) {
        requireSource(CommentSource.AI);
        if (status != CommentStatus.ACTIVE)
            throw new IllegalStateException("Expected %s but was %s".formatted(CommentStatus.ACTIVE, status));
        this.status = CommentStatus.ADOPTED;
        this.adoptedAsId = userCommentId;
        touch(now);
    }

    /** Brings back a soft-deleted user comment with a new body. */
    public void reactivate(String newBody, Instant now) {
        requireSource(CommentSource.USER);
        this.body = newBody;
        this.status = CommentStatus.DRAFT;
        touch(now);
    }

    public void softDelete(Instant now) {
        requireSource(CommentSource.USER);
        this.status = CommentStatus.INACTIVE;
        touch(now);
    }

    public void markSubmitted(Instant now) {
        requireSource(CommentSource.USER);
        this.status = CommentStatus.SUBMITTED;
        touch(now);
    }

    /** Detaches a user comment from a suggestion that no longer exists and dismisses it. */
    public void orphan(Instant now) {
        requireSource(CommentSource.USER);
        this.parentId = null;
        this.status = CommentStatus.DISMISSED;
        touch(now);
    }

    private void requireSource(CommentSource expected) {
        if (source != expected)
            throw new IllegalStateException("Expected %s comment but was %s".formatted(expected, source));
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }

    // Getters
    public Long getId() {
        return id;
    }

    public Long getReviewId() {
        return reviewId;
    }

    public CommentSource getSource() {
        return source;
    }

    public String getAuthor() {
        return author;
    }

    public UUID getAiRunId() {
        return aiRunId;
    }

    public Integer getAiLevel() {
        return aiLevel;
    }

    public Double getAiConfidence() {
        return aiConfidence;
    }

    public String getVoiceId() {
        return voiceId;
    }

    public boolean isRaw() {
        return raw;
    }

    public String getFile() {
        return file;
    }

    public Integer getLineStart() {
        return lineStart;
    }

    public Integer getLineEnd() {
        return lineEnd;
    }

    public Side getSide() {
        return side;
    }

    public String getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public String getReasoning() {
        return reasoning;
    }

    public CommentStatus getStatus() {
        return status;
    }

    public boolean isFileLevel() {
        return fileLevel;
    }

    public Long getParentId() {
        return parentId;
    }

    public Long getAdoptedAsId() {
        return adoptedAsId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
