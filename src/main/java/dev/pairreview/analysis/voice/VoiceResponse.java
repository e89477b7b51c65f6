package dev.pairreview.analysis.voice;

import dev.pairreview.domain.valueobject.SuggestionDraft;

import java.util.List;

/**
 * Parsed result of a voice: its suggestions (level not yet assigned), summary and the raw text.
 */
public record VoiceResponse(List<SuggestionDraft> suggestions, String summary, String rawText) {

    public VoiceResponse {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
