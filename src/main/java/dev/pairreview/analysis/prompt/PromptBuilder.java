package dev.pairreview.analysis.prompt;

import dev.pairreview.analysis.AnalysisInput;
import dev.pairreview.domain.enums.VoiceTier;
import dev.pairreview.domain.valueobject.RunInstructions;
import dev.pairreview.domain.valueobject.SuggestionDraft;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Prompt construction for level passes and consolidation.
 */
public final class PromptBuilder {

    static final String OUTPUT_CONTRACT = """
            Respond ONLY with JSON:
            {"suggestions":[{"file":"path","line_start":0,"line_end":0,"old_or_new":"NEW|OLD",
            "type":"bug|security|performance|design|improvement|code-style|suggestion|praise",
            "title":"...","description":"...","suggestion":"...","confidence":0.0,"is_file_level":false}],
            "summary":"..."}""";

    private PromptBuilder() {}

    public static String levelPrompt(int level, VoiceTier tier, AnalysisInput input,
                                     List<SuggestionDraft> priorFindings) {
        var sb = new StringBuilder();
        sb.append(levelFocus(level)).append("\n").append(depth(tier)).append("\n\n");
        sb.append("Repository: %s @ %s\n".formatted(input.repository(), shortSha(input.headSha())));
        appendInstructions(sb, input.instructions());
        sb.append("\nChanged files:\n");
        input.changedFiles().forEach(f -> sb.append("- ").append(f).append('\n'));
        if (!priorFindings.isEmpty()) {
            sb.append("\n--- FINDINGS FROM PREVIOUS LEVEL ---\n")
              .append(formatFindings(priorFindings, false))
              .append("--- END FINDINGS ---\n")
              .append("Do not repeat these; go deeper.\n");
        }
        sb.append("\nDiff:\n").append(input.diffText()).append("\n\n").append(OUTPUT_CONTRACT);
        return sb.toString();
    }

    /**
     * Merge prompt over candidate suggestions, each tagged {@code [cN]} in input order.
     */
    public static String consolidationPrompt(VoiceTier tier, AnalysisInput input,
                                             List<SuggestionDraft> candidates, int sourceCount) {
        var sb = new StringBuilder();
        sb.append("""
                You are consolidating code review findings from %d source(s) into one final set.
                Merge duplicates (same file, overlapping lines, same type) keeping the clearest wording,
                drop findings that are wrong or trivial, and keep line numbers unchanged.
                """.formatted(sourceCount));
        sb.append(depth(tier)).append("\n\n");
        sb.append("Repository: %s @ %s\n".formatted(input.repository(), shortSha(input.headSha())));
        appendInstructions(sb, input.instructions());
        sb.append("\nCandidates:\n").append(formatFindings(candidates, true));
        sb.append("\n").append(OUTPUT_CONTRACT);
        return sb.toString();
    }

    // ── Internal ───────────────────────────────────────────────────

    private static String levelFocus(int level) {
        return switch (level) {
            case 1 -> "Level 1 review: scan only the changed lines for bugs, obvious errors and risky edits.";
            case 2 -> "Level 2 review: read each changed file as a whole; check consistency, error handling "
                    + "and how the change fits the surrounding code.";
            case 3 -> "Level 3 review: consider the change against the whole codebase; look at callers, "
                    + "architecture, tests and cross-file impact.";
            default -> throw new IllegalArgumentException("Level must be 1-3 but was " + level);
        };
    }

    private static String depth(VoiceTier tier) {
        return switch (tier.promptTier()) {
            case FAST -> "Be brief. Report only high-confidence findings.";
            case BALANCED -> "Balance thoroughness with precision.";
            default -> "Be exhaustive. Verify each finding against the code before reporting it.";
        };
    }

    private static void appendInstructions(StringBuilder sb, RunInstructions instructions) {
        if (instructions.isEmpty()) return;
        sb.append("\n--- INSTRUCTIONS ---\n");
        if (instructions.repoInstructions() != null && !instructions.repoInstructions().isBlank())
            sb.append(instructions.repoInstructions().strip()).append('\n');
        if (instructions.requestInstructions() != null && !instructions.requestInstructions().isBlank())
            sb.append(instructions.requestInstructions().strip()).append('\n');
        sb.append("--- END INSTRUCTIONS ---\n");
    }

    static String formatFindings(List<SuggestionDraft> findings, boolean withIds) {
        var sb = new StringBuilder();
        for (int i = 0; i < findings.size(); i++) {
            SuggestionDraft f = findings.get(i);
            if (withIds) sb.append("[c").append(i + 1).append("] ");
            sb.append(String.format(Locale.ROOT, "[%s] %s%s (confidence %.2f) %s",
                    f.type(), f.file(), lines(f), f.confidence(), f.title()));
            if (withIds && f.body() != null && !f.body().isBlank()) {
                sb.append("\n    ").append(f.body().strip().lines().collect(Collectors.joining("\n    ")));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String lines(SuggestionDraft f) {
        if (f.fileLevel() || f.lineStart() == null) return "";
        return f.lineEnd() != null && !f.lineEnd().equals(f.lineStart())
                ? ":%d-%d".formatted(f.lineStart(), f.lineEnd())
                : ":" + f.lineStart();
    }

    private static String shortSha(String sha) {
        return sha == null ? "working copy" : sha.substring(0, Math.min(7, sha.length()));
    }
}
