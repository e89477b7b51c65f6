package dev.pairreview.snapshot;

import dev.pairreview.config.WorkspaceProperties;
import dev.pairreview.domain.valueobject.DiffStats;
import dev.pairreview.domain.valueobject.DiffStats.FileChange;
import dev.pairreview.exception.GitCommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Captures the reviewable diff of a working copy and answers whether it has changed since.
 *
 * <p>Only unstaged tracked changes and untracked files are reviewed. Staged changes are counted
 * but excluded from both the diff and the digest, so staging a file hides it from review.
 *
 * <p>Digest: {@code sha256(git diff + "\n---UNTRACKED---\n" + "path:size:mtime\n"...)}, first
 * 16 hex characters.
 */
@Component
public class DiffSnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(DiffSnapshotProvider.class);

    static final String UNTRACKED_SEPARATOR = "\n---UNTRACKED---\n";
    private static final int BINARY_SNIFF_BYTES = 8 * 1024;
    private static final int DIGEST_LENGTH = 16;

    private final GitCommandRunner git;
    private final long maxUntrackedFileBytes;

    public DiffSnapshotProvider(GitCommandRunner git, WorkspaceProperties properties) {
        this.git = git;
        this.maxUntrackedFileBytes = properties.maxUntrackedFileBytes();
    }

    /**
     * Captures unstaged tracked changes plus untracked files of the working copy at {@code repoPath}.
     *
     * @throws GitCommandException when the tracked diff or the untracked listing cannot be produced
     */
    public CapturedDiff capture(Path repoPath) {
        int staged = countStaged(repoPath);

        String unstagedDiff = git.output(repoPath, "diff", "--no-color", "--no-ext-diff", "--unified=25");
        List<FileChange> files = new ArrayList<>(parseNumstat(git.output(repoPath, "diff", "--numstat")));
        int unstaged = countFileHeaders(unstagedDiff);

        List<String> untracked = listUntracked(repoPath);
        StringBuilder diff = new StringBuilder(unstagedDiff);
        for (String path : untracked) {
            UntrackedDiff result = diffUntracked(repoPath, path);
            files.add(result.change());
            if (result.diff() != null && !result.diff().isEmpty()) {
                if (!diff.isEmpty() && diff.charAt(diff.length() - 1) != '\n') diff.append('\n');
                diff.append(result.diff());
            }
        }

        DiffStats stats = new DiffStats(unstaged, untracked.size(), staged, unstaged, files);
        String digest = computeDigest(repoPath).orElse(null);
        log.info("Captured diff for {}: {} unstaged, {} untracked ({} skipped), {} staged (excluded), digest {}",
                repoPath, unstaged, untracked.size(),
                files.stream().filter(f -> f.skipReason() != null).count(), staged, digest);
        return new CapturedDiff(diff.toString(), stats, digest);
    }

    /**
     * Captures the committed range {@code base...head} of a pull request worktree. The digest is the
     * hash of the diff itself since the range is immutable.
     */
    public CapturedDiff captureRange(Path worktreePath, String baseSha, String headSha) {
        String range = baseSha + "..." + headSha;
        String diff = git.output(worktreePath, "diff", "--no-color", "--no-ext-diff", "--unified=25", range);
        List<FileChange> files = parseNumstat(git.output(worktreePath, "diff", "--numstat", range));
        DiffStats stats = new DiffStats(files.size(), 0, 0, 0, files);
        return new CapturedDiff(diff, stats, sha256Prefix(diff));
    }

    /**
     * Digest of the current reviewable state, or empty when git failed and nothing could be read.
     */
    public Optional<String> computeDigest(Path repoPath) {
        boolean failed = false;

        String unstagedDiff = "";
        try {
            unstagedDiff = git.output(repoPath, "diff");
        } catch (GitCommandException e) {
            log.debug("Digest: git diff failed in {}: {}", repoPath, e.getMessage());
            failed = true;
        }

        StringBuilder untrackedInfo = new StringBuilder();
        try {
            for (String file : listUntracked(repoPath)) {
                Path resolved = repoPath.resolve(file);
                try {
                    untrackedInfo.append(file).append(':').append(Files.size(resolved)).append(':')
                            .append(Files.getLastModifiedTime(resolved).toMillis()).append('\n');
                } catch (IOException e) {
                    untrackedInfo.append(file).append(":missing\n");
                }
            }
        } catch (GitCommandException e) {
            log.debug("Digest: untracked listing failed in {}: {}", repoPath, e.getMessage());
            failed = true;
        }

        if (failed && unstagedDiff.isEmpty() && untrackedInfo.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(sha256Prefix(unstagedDiff + UNTRACKED_SEPARATOR + untrackedInfo));
    }

    /**
     * True when the working copy no longer matches {@code storedDigest}. Any failure to compute the
     * current digest counts as stale.
     */
    public boolean isStale(Path repoPath, String storedDigest) {
        if (storedDigest == null || storedDigest.isBlank()) {
            log.debug("No stored digest for {}; treating as stale", repoPath);
            return true;
        }
        Optional<String> current;
        try {
            current = computeDigest(repoPath);
        } catch (RuntimeException e) {
            log.warn("Could not compute digest for {}; treating as stale: {}", repoPath, e.getMessage());
            return true;
        }
        if (current.isEmpty()) {
            log.warn("Could not compute digest for {}; treating as stale", repoPath);
            return true;
        }
        return !current.get().equals(storedDigest);
    }

    // ── Internal ───────────────────────────────────────────────────

    private record UntrackedDiff(FileChange change, String diff) {}

    private int countStaged(Path repoPath) {
        try {
            return git.run(repoPath, Set.of(0), "diff", "--cached", "--name-only").lines().size();
        } catch (GitCommandException e) {
            log.warn("Could not count staged changes in {}: {}", repoPath, e.getMessage());
            return 0;
        }
    }

    private List<String> listUntracked(Path repoPath) {
        return git.run(repoPath, Set.of(0), "ls-files", "--others", "--exclude-standard")
                .lines().stream().sorted().toList();
    }

    private UntrackedDiff diffUntracked(Path repoPath, String relativePath) {
        Path file = repoPath.resolve(relativePath);
        try {
            long size = Files.size(file);
            if (size > maxUntrackedFileBytes) {
                return new UntrackedDiff(FileChange.skipped(relativePath,
                        "File too large (>%s)".formatted(formatSize(maxUntrackedFileBytes))), null);
            }
            if (looksBinary(file)) {
                return new UntrackedDiff(FileChange.skipped(relativePath, "Binary file"), null);
            }
        } catch (IOException e) {
            return new UntrackedDiff(FileChange.skipped(relativePath, "Could not read file: " + e.getMessage()), null);
        }

        // --no-index exits 1 when the inputs differ, which is the expected case here
        String diff = git.run(repoPath, Set.of(0, 1),
                "diff", "--no-index", "--no-color", "--no-ext-diff", "--", "/dev/null", relativePath).stdout();
        int additions = (int) diff.lines()
                .filter(line -> line.startsWith("+") && !line.startsWith("+++"))
                .count();
        return new UntrackedDiff(new FileChange(relativePath, additions, 0, true, null), diff);
    }

    private static boolean looksBinary(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] head = in.readNBytes(BINARY_SNIFF_BYTES);
            for (byte b : head) {
                if (b == 0) return true;
            }
            return false;
        }
    }

    static List<FileChange> parseNumstat(String numstat) {
        List<FileChange> changes = new ArrayList<>();
        for (String line : numstat.split("\n")) {
            String[] parts = line.split("\t", 3);
            if (parts.length < 3) continue;
            changes.add(new FileChange(parts[2], parseCount(parts[0]), parseCount(parts[1]), false, null));
        }
        return changes;
    }

    private static int parseCount(String value) {
        // binary files report "-"
        return "-".equals(value) ? 0 : Integer.parseInt(value);
    }

    private static int countFileHeaders(String diff) {
        return (int) diff.lines().filter(line -> line.startsWith("diff --git")).count();
    }

    private static String formatSize(long bytes) {
        long mb = 1024 * 1024;
        return bytes % mb == 0 ? (bytes / mb) + "MB" : bytes + " bytes";
    }

    static String sha256Prefix(String input) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DIGEST_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
