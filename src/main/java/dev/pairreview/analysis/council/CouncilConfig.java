package dev.pairreview.analysis.council;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Council configuration in either accepted shape.
 *
 * <ul>
 *   <li>Voice-centric: {@code voices[]} plus {@code levels} of booleans,
 *       e.g. {@code {"1":true,"2":false}}, and an optional {@code consolidation} voice.</li>
 *   <li>Level-centric: {@code levels} of objects, e.g. {@code {"1":{"enabled":true,"voices":[...]}}},
 *       and an optional {@code orchestration} voice.</li>
 * </ul>
 */
public record CouncilConfig(List<VoiceEntry> voices, JsonNode levels, VoiceEntry consolidation,
                            VoiceEntry orchestration) {

    public boolean isLevelCentric() {
        if (levels == null || !levels.isObject()) return false;
        for (JsonNode value : levels) {
            if (value.isObject()) return true;
        }
        return false;
    }
}
