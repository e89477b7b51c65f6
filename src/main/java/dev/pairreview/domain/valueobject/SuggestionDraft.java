package dev.pairreview.domain.valueobject;

import dev.pairreview.domain.enums.Side;

/**
 * A suggestion produced by a voice before it is stored.
 *
 * <p>{@code level} is 1-3 for per-level output and {@code null} for the consolidated set.
 * {@code voiceIndex} is the council position of the producing voice (0 for single runs) and
 * is used as a deduplication tie-break.
 */
public record SuggestionDraft(String file, Integer lineStart, Integer lineEnd, Side side,
                              String type, String title, String body, String reasoning,
                              double confidence, boolean fileLevel, Integer level, int voiceIndex) {

    public SuggestionDraft {
        if (side == null) side = Side.RIGHT;
        if (lineEnd == null) lineEnd = lineStart;
    }

    public SuggestionDraft atLevel(Integer newLevel) {
        return new SuggestionDraft(file, lineStart, lineEnd, side, type, title, body, reasoning,
                confidence, fileLevel, newLevel, voiceIndex);
    }

    public SuggestionDraft fromVoice(int index) {
        return new SuggestionDraft(file, lineStart, lineEnd, side, type, title, body, reasoning,
                confidence, fileLevel, level, index);
    }

    /** Effective ordering level: final (null) sorts after every numbered level when merging. */
    public int levelRank() {
        return level == null ? Integer.MAX_VALUE : level;
    }
}
