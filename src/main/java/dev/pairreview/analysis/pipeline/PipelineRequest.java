package dev.pairreview.analysis.pipeline;

import dev.pairreview.analysis.AnalysisInput;
import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.VoiceSpec;

import java.util.UUID;

/**
 * One voice's pass over a review. {@code raw} marks output that a council parent will consolidate;
 * {@code voiceId} is what the stored suggestions are attributed to.
 */
public record PipelineRequest(UUID runId, AnalysisInput input, VoiceSpec voice, int voiceIndex,
                              String voiceId, EnabledLevels levels, boolean raw) {

    public static PipelineRequest single(UUID runId, AnalysisInput input, VoiceSpec voice, EnabledLevels levels) {
        return new PipelineRequest(runId, input, voice, 0, voice.key(), levels, false);
    }
}
