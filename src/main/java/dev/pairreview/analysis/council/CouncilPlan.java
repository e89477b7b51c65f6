package dev.pairreview.analysis.council;

import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.VoiceSpec;

import java.util.List;

/**
 * Validated council: one plan per distinct voice, the voice that merges their output (null when a
 * single voice's result is promoted as is) and the union of enabled levels recorded on the parent run.
 */
public record CouncilPlan(List<VoicePlan> voices, VoiceSpec consolidationVoice, EnabledLevels parentLevels) {

    public CouncilPlan {
        voices = List.copyOf(voices);
    }

    public record VoicePlan(int index, VoiceSpec voice, EnabledLevels levels) {

        /** Attribution for raw suggestions; the index keeps two identical voices apart. */
        public String voiceId() {
            return voice.key() + "#" + index;
        }
    }
}
