package dev.pairreview.analysis.prompt;

import dev.pairreview.analysis.AnalysisInput;
import dev.pairreview.domain.enums.Side;
import dev.pairreview.domain.enums.VoiceTier;
import dev.pairreview.domain.valueobject.RunInstructions;
import dev.pairreview.domain.valueobject.SuggestionDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptBuilderTest {

    @Test
    @DisplayName("level prompt carries focus, instructions, files and diff")
    void levelPromptContents() {
        AnalysisInput input = input(new RunInstructions("Prefer records", "Focus on auth"));

        String prompt = PromptBuilder.levelPrompt(2, VoiceTier.FAST, input, List.of());

        assertThat(prompt)
                .startsWith("Level 2 review")
                .contains("Be brief.")
                .contains("Repository: acme/shop @ abcdef1")
                .contains("Prefer records\nFocus on auth")
                .contains("- src/Auth.java")
                .contains("+ return token;")
                .doesNotContain("FINDINGS FROM PREVIOUS LEVEL")
                .endsWith(PromptBuilder.OUTPUT_CONTRACT);
    }

    @Test
    @DisplayName("prior findings are listed without ids and instructions are omitted when blank")
    void levelPromptWithPriorFindings() {
        String prompt = PromptBuilder.levelPrompt(3, VoiceTier.PREMIUM, input(RunInstructions.none()),
                List.of(draft("src/Auth.java", 10, 12, "bug", "Token leak")));

        assertThat(prompt)
                .contains("Be exhaustive.")
                .contains("--- FINDINGS FROM PREVIOUS LEVEL ---\n[bug] src/Auth.java:10-12 (confidence 0.80) Token leak\n")
                .doesNotContain("[c1]")
                .doesNotContain("INSTRUCTIONS");
    }

    @Test
    @DisplayName("consolidation prompt tags candidates in order")
    void consolidationTagsCandidates() {
        List<SuggestionDraft> candidates = List.of(
                draft("a.js", 1, null, "bug", "First"),
                draft("b.js", null, null, "design", "Second"));

        String prompt = PromptBuilder.consolidationPrompt(VoiceTier.BALANCED, input(RunInstructions.none()),
                candidates, 2);

        assertThat(prompt)
                .contains("from 2 source(s)")
                .contains("[c1] [bug] a.js:1 (confidence 0.80) First\n    body of First")
                .contains("[c2] [design] b.js (confidence 0.80) Second")
                .doesNotContain("[c3]");
    }

    @Test
    @DisplayName("a level outside 1-3 is rejected")
    void rejectsUnknownLevel() {
        assertThatThrownBy(() -> PromptBuilder.levelPrompt(4, VoiceTier.FAST, input(RunInstructions.none()),
                List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ── Test Fixtures ───────────────────────────────────────────────

    private static AnalysisInput input(RunInstructions instructions) {
        return new AnalysisInput(1L, "acme/shop", "abcdef1234567890", Path.of("/tmp/wt"),
                "diff --git a/src/Auth.java b/src/Auth.java\n+ return token;", List.of("src/Auth.java"),
                instructions);
    }

    private static SuggestionDraft draft(String file, Integer start, Integer end, String type, String title) {
        return new SuggestionDraft(file, start, end, Side.RIGHT, type, title, "body of " + title, null,
                0.8, start == null, 1, 0);
    }
}
