package dev.pairreview.dto.response;

import dev.pairreview.domain.entity.AnalysisRun;
import dev.pairreview.domain.enums.ConfigType;
import dev.pairreview.domain.enums.RunStatus;
import dev.pairreview.domain.enums.VoiceTier;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record AnalysisRunResponse(
        UUID id, long reviewId, UUID parentRunId, ConfigType configType,
        String provider, String model, VoiceTier tier, Map<String, Boolean> levels,
        String headSha, RunStatus status, int filesAnalyzed, int totalSuggestions,
        String summary, String errorMessage, Instant startedAt, Instant completedAt
) {

    public static AnalysisRunResponse from(AnalysisRun r) {
        return new AnalysisRunResponse(r.getId(), r.getReviewId(), r.getParentRunId(), r.getConfigType(),
                r.getProvider(), r.getModel(), r.getTier(), r.getLevelsConfig(), r.getHeadSha(), r.getStatus(),
                r.getFilesAnalyzed(), r.getTotalSuggestions(), r.getSummary(), r.getErrorMessage(),
                r.getStartedAt(), r.getCompletedAt());
    }
}
