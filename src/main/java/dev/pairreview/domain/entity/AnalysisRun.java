package dev.pairreview.domain.entity;

import dev.pairreview.domain.enums.ConfigType;
import dev.pairreview.domain.enums.RunStatus;
import dev.pairreview.domain.enums.VoiceTier;
import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.RunUpdate;
import dev.pairreview.domain.valueobject.VoiceSpec;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One execution of the orchestration engine.
 *
 * <p>A council parent has no provider, model or tier; its children carry its id as
 * {@code parentRunId}. Status moves from RUNNING to exactly one terminal state and the row is
 * immutable afterwards. {@link #apply} is the only mutator and refuses to touch a terminal run.
 */
@Entity
@Table(name = "analysis_runs", indexes = {
        @Index(name = "idx_analysis_runs_review", columnList = "review_id, started_at"),
        @Index(name = "idx_analysis_runs_parent", columnList = "parent_run_id"),
        @Index(name = "idx_analysis_runs_status", columnList = "status")
})
public class AnalysisRun {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "review_id", nullable = false)
    private Long reviewId;

    @Column(name = "parent_run_id", columnDefinition = "uuid")
    private UUID parentRunId;

    @Enumerated(EnumType.STRING)
    @Column(name = "config_type", nullable = false, length = 16)
    private ConfigType configType;

    private String provider;

    private String model;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private VoiceTier tier;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "levels_config", columnDefinition = "jsonb")
    private Map<String, Boolean> levelsConfig;

    @Column(name = "repo_instructions", columnDefinition = "text")
    private String repoInstructions;

    @Column(name = "request_instructions", columnDefinition = "text")
    private String requestInstructions;

    @Column(name = "head_sha", length = 64)
    private String headSha;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunStatus status;

    @Column(name = "files_analyzed", nullable = false)
    private int filesAnalyzed;

    @Column(name = "total_suggestions", nullable = false)
    private int totalSuggestions;

    @Column(columnDefinition = "text")
    private String summary;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected AnalysisRun() {
    }

    public static AnalysisRun createSingle(long reviewId, UUID parentRunId, VoiceSpec voice,
            EnabledLevels levels, String repoInstructions, String requestInstructions,
            String headSha, Instant now) {
        AnalysisRun run = base(reviewId, levels, repoInstructions, requestInstructions, headSha, now);
        run.parentRunId = parentRunId;
        run.configType = ConfigType.SINGLE;
        run.provider = voice.provider();
        run.model = voice.model();
        run.tier = voice.tier();
        return run;
    }

    public static AnalysisRun createCouncilParent(long reviewId, EnabledLevels levels,
            String repoInstructions, String requestInstructions, String headSha, Instant now) {
        AnalysisRun run = base(reviewId, levels, repoInstructions, requestInstructions, headSha, now);
        run.configType = ConfigType.COUNCIL;
        return run;
    }

    private static AnalysisRun base(long reviewId, EnabledLevels levels, String repoInstructions,
            String requestInstructions, String headSha, Instant now) {
        AnalysisRun run = new AnalysisRun();
        run.id = UUID.randomUUID();
        run.reviewId = reviewId;
        run.levelsConfig = levels.toMap();
        run.repoInstructions = repoInstructions;
        run.requestInstructions = requestInstructions;
        run.headSha = headSha;
        run.status = RunStatus.RUNNING;
        run.startedAt = now;
        return run;
    }

    /**
     * Applies an update while the run is still RUNNING.
     *
     * @return false when the run was already terminal and nothing changed
     */
    public boolean apply(RunUpdate update, Instant now) {
        if (status.isTerminal()) return false;

        if (update.summary() != null) this.summary = update.summary();
        if (update.totalSuggestions() != null) this.totalSuggestions = update.totalSuggestions();
        if (update.filesAnalyzed() != null) this.filesAnalyzed = update.filesAnalyzed();
        if (update.errorMessage() != null) this.errorMessage = truncate(update.errorMessage());

        if (update.status() != null && update.status().isTerminal()) {
            this.status = update.status();
            this.completedAt = now;
        }
        return true;
    }

    public EnabledLevels getEnabledLevels() {
        return EnabledLevels.fromMap(levelsConfig);
    }

    private static String truncate(String message) {
        return message.length() <= 2000 ? message : message.substring(0, 2000);
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public Long getReviewId() {
        return reviewId;
    }

    public UUID getParentRunId() {
        return parentRunId;
    }

    public ConfigType getConfigType() {
        return configType;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public VoiceTier getTier() {
        return tier;
    }

    public Map<String, Boolean> getLevelsConfig() {
        return levelsConfig == null ? Map.of() : Map.copyOf(levelsConfig);
    }

    public String getRepoInstructions() {
        return repoInstructions;
    }

    public String getRequestInstructions() {
        return requestInstructions;
    }

    public String getHeadSha() {
        return headSha;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getFilesAnalyzed() {
        return filesAnalyzed;
    }

    public int getTotalSuggestions() {
        return totalSuggestions;
    }

    public String getSummary() {
        return summary;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
