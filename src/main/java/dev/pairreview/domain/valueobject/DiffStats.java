package dev.pairreview.domain.valueobject;

import java.util.List;

/**
 * Change counts for a captured diff plus one entry per file. Stored as JSON on the snapshot row.
 */
public record DiffStats(int trackedChanges, int untrackedFiles, int stagedChanges,
                        int unstagedChanges, List<FileChange> files) {

    public DiffStats {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static DiffStats empty() {
        return new DiffStats(0, 0, 0, 0, List.of());
    }

    /** Paths a voice should look at: every changed file that was not skipped. */
    public List<String> reviewablePaths() {
        return files.stream()
                .filter(f -> f.skipReason() == null)
                .map(FileChange::path)
                .toList();
    }

    /**
     * @param skipReason why an untracked file was left out of the diff, or null when it was included
     */
    public record FileChange(String path, int additions, int deletions, boolean untracked, String skipReason) {
        public static FileChange skipped(String path, String reason) {
            return new FileChange(path, 0, 0, true, reason);
        }
    }
}
