package dev.pairreview.analysis.council;

import dev.pairreview.domain.enums.VoiceTier;
import dev.pairreview.domain.valueobject.VoiceSpec;

/**
 * A voice as it arrives in a council config; {@code tier} is free text ("fast", "premium", "free").
 */
public record VoiceEntry(String provider, String model, String tier) {

    VoiceSpec toSpec() {
        return new VoiceSpec(provider, model, VoiceTier.parse(tier, VoiceTier.BALANCED));
    }
}
