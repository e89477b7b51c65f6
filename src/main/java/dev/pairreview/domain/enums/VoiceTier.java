package dev.pairreview.domain.enums;

import java.util.Locale;

/**
 * Analysis depth requested from a voice. PREMIUM shares the THOROUGH prompts.
 */
public enum VoiceTier {
    FAST, BALANCED, THOROUGH, PREMIUM;

    public VoiceTier promptTier() {
        return this == PREMIUM ? THOROUGH : this;
    }

    /** Lenient parse accepting the lower-case names and the "free" alias. */
    public static VoiceTier parse(String value, VoiceTier fallback) {
        if (value == null || value.isBlank()) return fallback;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("free")) return FAST;
        try {
            return valueOf(normalized.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tier: " + value, e);
        }
    }
}
