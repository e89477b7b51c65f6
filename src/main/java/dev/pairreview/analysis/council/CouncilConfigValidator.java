package dev.pairreview.analysis.council;

import com.fasterxml.jackson.databind.JsonNode;
import dev.pairreview.analysis.council.CouncilPlan.VoicePlan;
import dev.pairreview.domain.valueobject.EnabledLevels;
import dev.pairreview.domain.valueobject.VoiceSpec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a {@link CouncilConfig} and normalises both shapes to a {@link CouncilPlan}.
 * Every rejection is an {@link IllegalArgumentException} with a message fit for the caller.
 */
public final class CouncilConfigValidator {

    private static final Set<String> LEVEL_KEYS = Set.of("1", "2", "3");

    private CouncilConfigValidator() {}

    public static CouncilPlan toPlan(CouncilConfig config) {
        if (config == null)
            throw new IllegalArgumentException("config is required");
        return config.isLevelCentric() ? fromLevelCentric(config) : fromVoiceCentric(config);
    }

    // ── Internal ───────────────────────────────────────────────────

    private static CouncilPlan fromVoiceCentric(CouncilConfig config) {
        List<VoiceEntry> voices = config.voices();
        if (voices == null || voices.isEmpty())
            throw new IllegalArgumentException("voices must be a non-empty array");
        for (int i = 0; i < voices.size(); i++) {
            requireComplete(voices.get(i), "voices[%d]".formatted(i));
        }

        JsonNode levelsNode = config.levels();
        if (levelsNode == null || !levelsNode.isObject())
            throw new IllegalArgumentException("levels is required and must be an object");
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = levelsNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            requireLevelKey(entry.getKey());
            flags.put(entry.getKey(), entry.getValue().asBoolean(false));
        }
        EnabledLevels levels = new EnabledLevels(
                Boolean.TRUE.equals(flags.get("1")),
                Boolean.TRUE.equals(flags.get("2")),
                Boolean.TRUE.equals(flags.get("3")));
        if (!levels.anyEnabled())
            throw new IllegalArgumentException("At least one level (1, 2, or 3) must be enabled");

        VoiceEntry consolidation = config.consolidation() != null ? config.consolidation() : config.orchestration();
        if (consolidation != null) requireComplete(consolidation, "consolidation");

        List<VoicePlan> plans = new ArrayList<>();
        for (int i = 0; i < voices.size(); i++) {
            plans.add(new VoicePlan(i, voices.get(i).toSpec(), levels));
        }
        return new CouncilPlan(plans, consolidator(consolidation, plans), levels);
    }

    /**
     * Each distinct voice gets one plan whose levels are those listing it, in first-seen order.
     */
    private static CouncilPlan fromLevelCentric(CouncilConfig config) {
        Map<VoiceSpec, boolean[]> byVoice = new LinkedHashMap<>();
        boolean[] anyLevel = new boolean[EnabledLevels.MAX_LEVEL];

        for (Iterator<Map.Entry<String, JsonNode>> it = config.levels().fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            requireLevelKey(key);
            JsonNode level = entry.getValue();
            if (!level.path("enabled").isBoolean())
                throw new IllegalArgumentException("levels.%s.enabled must be a boolean".formatted(key));
            if (!level.path("enabled").booleanValue()) continue;

            JsonNode voices = level.path("voices");
            if (!voices.isArray() || voices.isEmpty())
                throw new IllegalArgumentException("levels.%s.voices must be a non-empty array when enabled"
                        .formatted(key));
            int levelIndex = Integer.parseInt(key) - 1;
            anyLevel[levelIndex] = true;
            for (int i = 0; i < voices.size(); i++) {
                VoiceEntry entryVoice = toEntry(voices.get(i));
                requireComplete(entryVoice, "levels.%s.voices[%d]".formatted(key, i));
                byVoice.computeIfAbsent(entryVoice.toSpec(), v -> new boolean[EnabledLevels.MAX_LEVEL])[levelIndex] = true;
            }
        }
        if (byVoice.isEmpty())
            throw new IllegalArgumentException("At least one level must be enabled");

        VoiceEntry orchestration = config.orchestration() != null ? config.orchestration() : config.consolidation();
        if (orchestration != null) requireComplete(orchestration, "orchestration");

        List<VoicePlan> plans = new ArrayList<>();
        byVoice.forEach((voice, flags) -> plans.add(
                new VoicePlan(plans.size(), voice, new EnabledLevels(flags[0], flags[1], flags[2]))));
        EnabledLevels parentLevels = new EnabledLevels(anyLevel[0], anyLevel[1], anyLevel[2]);
        return new CouncilPlan(plans, consolidator(orchestration, plans), parentLevels);
    }

    /** The configured voice; otherwise the first voice when there are several; otherwise none. */
    private static VoiceSpec consolidator(VoiceEntry configured, List<VoicePlan> plans) {
        if (configured != null) return configured.toSpec();
        return plans.size() > 1 ? plans.get(0).voice() : null;
    }

    private static VoiceEntry toEntry(JsonNode node) {
        return new VoiceEntry(node.path("provider").asText(null), node.path("model").asText(null),
                node.path("tier").asText(null));
    }

    private static void requireComplete(VoiceEntry voice, String path) {
        if (voice.provider() == null || voice.provider().isBlank())
            throw new IllegalArgumentException(path + ".provider is required");
        if (voice.model() == null || voice.model().isBlank())
            throw new IllegalArgumentException(path + ".model is required");
    }

    private static void requireLevelKey(String key) {
        if (!LEVEL_KEYS.contains(key))
            throw new IllegalArgumentException("Invalid level key: \"%s\". Valid keys: 1, 2, 3".formatted(key));
    }
}
