package dev.pairreview.domain.valueobject;

import dev.pairreview.domain.enums.VoiceTier;

/**
 * One analysis participant: a provider CLI, the model it should use and the prompt tier.
 */
public record VoiceSpec(String provider, String model, VoiceTier tier) {

    public VoiceSpec {
        if (provider == null || provider.isBlank())
            throw new IllegalArgumentException("provider is required");
        if (model == null || model.isBlank())
            throw new IllegalArgumentException("model is required");
        if (tier == null) tier = VoiceTier.BALANCED;
    }

    /** Stable identifier stored on suggestions as {@code voice_id}. */
    public String key() {
        return "%s/%s/%s".formatted(provider, model, tier.name().toLowerCase(java.util.Locale.ROOT));
    }
}
