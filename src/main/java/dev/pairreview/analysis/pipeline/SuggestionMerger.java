package dev.pairreview.analysis.pipeline;

import dev.pairreview.domain.valueobject.SuggestionDraft;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic deduplication of suggestions gathered from several levels or voices.
 *
 * <p>Two suggestions are duplicates when they name the same file, the same type (ignoring case)
 * and their line ranges intersect. A file-level suggestion only duplicates another file-level
 * one. The survivor is the most confident; ties go to the lower voice index, then the lower
 * level, then whichever came first. Output is ordered by file, start line, then input order.
 */
public final class SuggestionMerger {

    private static final Comparator<Ranked> OUTPUT_ORDER = Comparator
            .comparing((Ranked r) -> r.draft().file(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(r -> r.draft().lineStart(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(Ranked::position);

    private SuggestionMerger() {}

    public static List<SuggestionDraft> deduplicate(List<SuggestionDraft> suggestions) {
        List<Ranked> kept = new ArrayList<>();
        for (int i = 0; i < suggestions.size(); i++) {
            Ranked candidate = new Ranked(suggestions.get(i), i);
            int match = indexOfDuplicate(kept, candidate.draft());
            if (match < 0) {
                kept.add(candidate);
            } else if (beats(candidate, kept.get(match))) {
                kept.set(match, candidate);
            }
        }
        kept.sort(OUTPUT_ORDER);
        return kept.stream().map(Ranked::draft).toList();
    }

    static boolean isDuplicate(SuggestionDraft a, SuggestionDraft b) {
        if (!Objects.equals(a.file(), b.file())) return false;
        if (!sameType(a.type(), b.type())) return false;
        boolean aFileLevel = isFileLevel(a);
        boolean bFileLevel = isFileLevel(b);
        if (aFileLevel || bFileLevel) return aFileLevel && bFileLevel;
        return a.lineStart() <= end(b) && b.lineStart() <= end(a);
    }

    // ── Internal ───────────────────────────────────────────────────

    private record Ranked(SuggestionDraft draft, int position) {}

    private static int indexOfDuplicate(List<Ranked> kept, SuggestionDraft draft) {
        for (int i = 0; i < kept.size(); i++) {
            if (isDuplicate(kept.get(i).draft(), draft)) return i;
        }
        return -1;
    }

    private static boolean beats(Ranked challenger, Ranked incumbent) {
        SuggestionDraft c = challenger.draft();
        SuggestionDraft i = incumbent.draft();
        int byConfidence = Double.compare(c.confidence(), i.confidence());
        if (byConfidence != 0) return byConfidence > 0;
        if (c.voiceIndex() != i.voiceIndex()) return c.voiceIndex() < i.voiceIndex();
        if (c.levelRank() != i.levelRank()) return c.levelRank() < i.levelRank();
        return challenger.position() < incumbent.position();
    }

    private static boolean sameType(String a, String b) {
        if (a == null || b == null) return a == null && b == null;
        return a.equalsIgnoreCase(b);
    }

    private static boolean isFileLevel(SuggestionDraft draft) {
        return draft.fileLevel() || draft.lineStart() == null;
    }

    private static int end(SuggestionDraft draft) {
        return draft.lineEnd() == null ? draft.lineStart() : Math.max(draft.lineStart(), draft.lineEnd());
    }
}
