package dev.pairreview.service;

import dev.pairreview.domain.entity.AnalysisRun;
import dev.pairreview.domain.entity.Comment;
import dev.pairreview.domain.enums.CommentSource;
import dev.pairreview.domain.enums.CommentStatus;
import dev.pairreview.domain.valueobject.SuggestionDraft;
import dev.pairreview.dto.response.CommentResponse;
import dev.pairreview.dto.response.SuggestionCheckResponse;
import dev.pairreview.exception.ResourceNotFoundException;
import dev.pairreview.repository.CommentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * AI suggestions and the user comments adopted from them.
 */
@Service
public class SuggestionService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionService.class);

    private static final Set<String> ISSUE_TYPES = Set.of("bug", "security", "performance");
    private static final List<CommentStatus> USER_DELETABLE =
            List.of(CommentStatus.ACTIVE, CommentStatus.DRAFT, CommentStatus.SUBMITTED);

    private final CommentRepository repository;
    private final AnalysisRunService runService;
    private final TimeSource time;

    public SuggestionService(CommentRepository repository, AnalysisRunService runService, TimeSource time) {
        this.repository = repository;
        this.runService = runService;
        this.time = time;
    }

    /** Writes one batch of a run's suggestions; a level's output is stored in a single transaction. */
    @Transactional
    public int storeSuggestions(long reviewId, UUID runId, List<SuggestionDraft> drafts, boolean raw,
                                String voiceId) {
        if (drafts.isEmpty()) return 0;
        Instant now = time.now();
        List<Comment> rows = drafts.stream()
                .map(d -> Comment.aiSuggestion(reviewId, runId, d, raw, voiceId, now))
                .toList();
        repository.saveAll(rows);
        log.debug("Stored {} {} suggestions for run {}", rows.size(), raw ? "raw" : "final", runId);
        return rows.size();
    }

    /**
     * Suggestions of {@code runId}, or of the run that most recently wrote suggestions.
     *
     * @param levels comma-separated subset of {@code final,1,2,3}; blank means {@code final}
     */
    @Transactional(readOnly = true)
    public List<CommentResponse> getSuggestions(long reviewId, String levels, UUID runId) {
        LevelFilter filter = LevelFilter.parse(levels);
        Optional<UUID> targetRun = runId != null ? Optional.of(runId) : latestSuggestionRun(reviewId);
        if (targetRun.isEmpty()) return List.of();

        return repository.findSuggestions(reviewId, targetRun.get(), filter.includeFinal(),
                        filter.levelsOrSentinel(), CommentStatus.VISIBLE).stream()
                .map(SuggestionService::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public SuggestionCheckResponse checkSuggestions(long reviewId, UUID runId) {
        boolean hasSuggestions = repository.existsByReviewIdAndSourceAndRawFalse(reviewId, CommentSource.AI);

        Optional<AnalysisRun> run;
        boolean analysisHasRun;
        try {
            run = runId != null ? runService.getById(runId) : runService.getLatestByReviewId(reviewId);
            analysisHasRun = run.isPresent() || hasSuggestions;
        } catch (RuntimeException e) {
            log.warn("Run lookup failed for review {}, falling back to suggestion presence: {}",
                    reviewId, e.getMessage());
            run = Optional.empty();
            analysisHasRun = hasSuggestions;
        }

        UUID statsRun = run.map(AnalysisRun::getId)
                .or(() -> latestSuggestionRun(reviewId))
                .orElse(null);
        SuggestionCheckResponse.Stats stats = statsRun == null
                ? SuggestionCheckResponse.Stats.empty()
                : stats(reviewId, statsRun);
        return new SuggestionCheckResponse(hasSuggestions, analysisHasRun, statsRun,
                run.map(AnalysisRun::getSummary).orElse(null), stats);
    }

    /**
     * Turns an ACTIVE suggestion into a draft user comment. A comment previously adopted from the
     * same suggestion and since deleted is brought back instead of creating a second one.
     */
    @Transactional
    public CommentResponse adopt(long suggestionId, String editedBody, String author) {
        Comment suggestion = requireSuggestion(suggestionId);
        if (suggestion.getStatus() != CommentStatus.ACTIVE)
            throw new IllegalStateException("Expected %s but was %s".formatted(CommentStatus.ACTIVE,
                    suggestion.getStatus()));

        Instant now = time.now();
        String body = editedBody != null && !editedBody.isBlank() ? editedBody : suggestion.getBody();
        Comment userComment = repository
                .findFirstByParentIdAndStatusOrderByIdDesc(suggestionId, CommentStatus.INACTIVE)
                .map(previous -> {
                    previous.reactivate(body, now);
                    return previous;
                })
                .orElseGet(() -> repository.save(Comment.adoptedFrom(suggestion, body, author, now)));

        suggestion.markAdopted(userComment.getId(), now);
        log.info("Adopted suggestion {} as comment {}", suggestionId, userComment.getId());
        return toResponse(userComment);
    }

    /** Dismisses ({@code DISMISSED}) or restores ({@code ACTIVE}) a suggestion. */
    @Transactional
    public CommentResponse updateStatus(long suggestionId, CommentStatus status) {
        Comment suggestion = requireSuggestion(suggestionId);
        Instant now = time.now();
        switch (status) {
            case DISMISSED -> suggestion.dismiss(now);
            case ACTIVE -> suggestion.restore(now);
            default -> throw new IllegalArgumentException(
                    "Suggestion status can only be set to ACTIVE or DISMISSED, not " + status);
        }
        return toResponse(suggestion);
    }

    /**
     * Soft-deletes every live user comment of a review and dismisses the suggestions they came from.
     *
     * @return number of user comments deleted
     */
    @Transactional
    public int bulkDeleteUserComments(long reviewId) {
        Instant now = time.now();
        List<Comment> comments = repository.findByReviewIdAndSourceAndStatusIn(reviewId, CommentSource.USER,
                USER_DELETABLE);
        Set<Long> parentIds = new LinkedHashSet<>();
        for (Comment comment : comments) {
            comment.softDelete(now);
            if (comment.getParentId() != null) parentIds.add(comment.getParentId());
        }
        repository.findAllById(parentIds).stream()
                .filter(parent -> parent.getSource() == CommentSource.AI)
                .forEach(parent -> parent.dismiss(now));
        log.info("Deleted {} user comments of review {} ({} suggestions dismissed)",
                comments.size(), reviewId, parentIds.size());
        return comments.size();
    }

    /**
     * Hard-deletes every AI suggestion of a review. User comments adopted from them are detached
     * and dismissed first.
     *
     * @return number of suggestions deleted
     */
    @Transactional
    public int deleteAiSuggestions(long reviewId) {
        List<Comment> suggestions = repository.findByReviewIdAndSource(reviewId, CommentSource.AI);
        if (suggestions.isEmpty()) return 0;

        Instant now = time.now();
        List<Long> ids = suggestions.stream().map(Comment::getId).toList();
        List<Comment> adopted = new ArrayList<>(repository.findByParentIdIn(ids));
        adopted.removeIf(c -> c.getSource() != CommentSource.USER);
        adopted.forEach(c -> c.orphan(now));
        repository.saveAllAndFlush(adopted);

        repository.deleteAllInBatch(suggestions);
        log.info("Deleted {} AI suggestions of review {} ({} adopted comments detached)",
                suggestions.size(), reviewId, adopted.size());
        return suggestions.size();
    }

    // ── Internal ───────────────────────────────────────────────────

    private Optional<UUID> latestSuggestionRun(long reviewId) {
        return repository.findLatestSuggestionRunIds(reviewId, PageRequest.of(0, 1)).stream().findFirst();
    }

    private SuggestionCheckResponse.Stats stats(long reviewId, UUID runId) {
        long issues = 0, praise = 0, other = 0;
        for (CommentRepository.TypeCount row : repository.countFinalByType(reviewId, runId)) {
            String type = row.getType() == null ? "" : row.getType().toLowerCase(Locale.ROOT);
            if ("praise".equals(type)) praise += row.getCount();
            else if (ISSUE_TYPES.contains(type)) issues += row.getCount();
            else other += row.getCount();
        }
        return new SuggestionCheckResponse.Stats(issues, other, praise);
    }

    private Comment requireSuggestion(long id) {
        Comment comment = repository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Suggestion", id));
        if (comment.getSource() != CommentSource.AI)
            throw new IllegalArgumentException("Comment %d is not an AI suggestion".formatted(id));
        return comment;
    }

    static CommentResponse toResponse(Comment c) {
        return new CommentResponse(c.getId(), c.getReviewId(), c.getSource(), c.getAuthor(),
                c.getAiRunId(), c.getAiLevel(), c.getAiConfidence(), c.getVoiceId(),
                c.getFile(), c.getLineStart(), c.getLineEnd(), c.getSide(), c.isFileLevel(),
                c.getType(), c.getTitle(), c.getBody(), c.getReasoning(),
                c.getStatus(), c.getParentId(), c.getAdoptedAsId(),
                c.getCreatedAt(), c.getUpdatedAt());
    }

    /** Parsed {@code levels} query value. */
    record LevelFilter(boolean includeFinal, List<Integer> levels) {

        static LevelFilter parse(String raw) {
            if (raw == null || raw.isBlank()) return new LevelFilter(true, List.of());
            boolean includeFinal = false;
            Set<Integer> levels = new LinkedHashSet<>();
            for (String token : raw.split(",")) {
                String value = token.strip().toLowerCase(Locale.ROOT);
                switch (value) {
                    case "final" -> includeFinal = true;
                    case "1", "2", "3" -> levels.add(Integer.parseInt(value));
                    case "" -> { }
                    default -> throw new IllegalArgumentException("Invalid level: " + token.strip());
                }
            }
            if (!includeFinal && levels.isEmpty())
                throw new IllegalArgumentException("At least one level is required");
            return new LevelFilter(includeFinal, List.copyOf(levels));
        }

        /** JPQL {@code in ()} cannot be empty, so an unused level stands in. */
        List<Integer> levelsOrSentinel() {
            return levels.isEmpty() ? List.of(-1) : levels;
        }
    }
}
