package dev.pairreview.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import dev.pairreview.domain.valueobject.EnabledLevels;

import java.util.Map;

/**
 * Single-voice analysis. Missing provider, model or tier fall back to the configured defaults;
 * missing levels mean all three. {@code skipLevel3} turns the codebase level off on top of
 * whatever {@code levels} enables.
 */
public record AnalysisRequest(String provider, String model, String tier,
                              Map<String, Boolean> levels,
                              @JsonAlias("customInstructions") String instructions,
                              Boolean skipLevel3) {

    public EnabledLevels enabledLevels() {
        EnabledLevels requested = EnabledLevels.fromMap(levels);
        return Boolean.TRUE.equals(skipLevel3)
                ? new EnabledLevels(requested.level1(), requested.level2(), false)
                : requested;
    }
}
