package dev.pairreview.snapshot;

import dev.pairreview.config.WorkspaceProperties;
import dev.pairreview.domain.valueobject.DiffStats.FileChange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs against real throwaway repositories; skipped where git is not installed.
 */
class DiffSnapshotProviderTest {

    @TempDir
    Path repo;

    private final ExecutorService ioExecutor = Executors.newCachedThreadPool();
    private GitCommandRunner git;
    private DiffSnapshotProvider provider;

    @AfterEach
    void tearDown() {
        ioExecutor.shutdownNow();
    }

    @BeforeEach
    void setUp() throws IOException {
        WorkspaceProperties properties = new WorkspaceProperties(repo.resolve("wt"), null, 64, Duration.ofSeconds(20));
        git = new GitCommandRunner(properties, ioExecutor);
        assumeTrue(gitAvailable(), "git is not installed");
        provider = new DiffSnapshotProvider(git, properties);

        git.output(repo, "init", "-q");
        Files.writeString(repo.resolve("app.txt"), "one\ntwo\nthree\n");
        Files.writeString(repo.resolve(".gitignore"), "wt/\n");
        git.output(repo, "add", ".");
        git.output(repo, "-c", "user.name=Test", "-c", "user.email=test@example.com", "commit", "-q", "-m", "init");
    }

    @Nested
    @DisplayName("Capture")
    class Capture {

        @Test
        @DisplayName("a clean working copy has an empty diff and a digest")
        void cleanCopy() {
            CapturedDiff captured = provider.capture(repo);

            assertThat(captured.diffText()).isEmpty();
            assertThat(captured.stats().files()).isEmpty();
            assertThat(captured.digest()).hasSize(16);
        }

        @Test
        @DisplayName("unstaged edits and untracked files are both reviewed")
        void unstagedAndUntracked() throws IOException {
            Files.writeString(repo.resolve("app.txt"), "one\nTWO\nthree\n");
            Files.writeString(repo.resolve("new.txt"), "hello\n");

            CapturedDiff captured = provider.capture(repo);

            assertThat(captured.diffText()).contains("+TWO").contains("+hello");
            assertThat(captured.stats().unstagedChanges()).isEqualTo(1);
            assertThat(captured.stats().untrackedFiles()).isEqualTo(1);
            assertThat(captured.stats().reviewablePaths()).containsExactlyInAnyOrder("app.txt", "new.txt");
        }

        @Test
        @DisplayName("staged edits are counted but left out of the diff")
        void stagedExcluded() throws IOException {
            Files.writeString(repo.resolve("app.txt"), "one\nTWO\nthree\n");
            git.output(repo, "add", "app.txt");

            CapturedDiff captured = provider.capture(repo);

            assertThat(captured.diffText()).doesNotContain("TWO");
            assertThat(captured.stats().stagedChanges()).isEqualTo(1);
        }

        @Test
        @DisplayName("binary and oversized untracked files are listed as skipped")
        void skippedUntracked() throws IOException {
            Files.write(repo.resolve("image.bin"), new byte[]{1, 0, 2});
            Files.writeString(repo.resolve("big.txt"), "x".repeat(100));

            CapturedDiff captured = provider.capture(repo);

            assertThat(captured.stats().files())
                    .extracting(FileChange::path, FileChange::skipReason)
                    .contains(
                            tuple("image.bin", "Binary file"),
                            tuple("big.txt", "File too large (>64 bytes)"));
            assertThat(captured.diffText()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Staleness")
    class Staleness {

        @Test
        @DisplayName("an unchanged working copy is fresh")
        void unchangedIsFresh() {
            String digest = provider.capture(repo).digest();

            assertThat(provider.isStale(repo, digest)).isFalse();
        }

        @Test
        @DisplayName("editing a tracked file makes the snapshot stale")
        void editIsStale() throws IOException {
            String digest = provider.capture(repo).digest();
            Files.writeString(repo.resolve("app.txt"), "changed\n");

            assertThat(provider.isStale(repo, digest)).isTrue();
        }

        @Test
        @DisplayName("adding an untracked file makes the snapshot stale")
        void untrackedIsStale() throws IOException {
            String digest = provider.capture(repo).digest();
            Files.writeString(repo.resolve("notes.md"), "todo\n");

            assertThat(provider.isStale(repo, digest)).isTrue();
        }

        @Test
        @DisplayName("staging a reviewed edit changes the digest")
        void stagingChangesDigest() throws IOException {
            Files.writeString(repo.resolve("app.txt"), "one\nTWO\nthree\n");
            String digest = provider.capture(repo).digest();
            git.output(repo, "add", "app.txt");

            assertThat(provider.isStale(repo, digest)).isTrue();
        }

        @Test
        @DisplayName("a missing digest or a directory outside git is always stale")
        void unknownIsStale(@TempDir Path plainDir) {
            assertThat(provider.isStale(repo, null)).isTrue();
            assertThat(provider.isStale(plainDir, "0123456789abcdef")).isTrue();
        }
    }

    @Test
    @DisplayName("a committed range is captured with a digest of its diff")
    void capturesRange() throws IOException {
        String base = git.output(repo, "rev-parse", "HEAD").strip();
        Files.writeString(repo.resolve("app.txt"), "one\ntwo\nthree\nfour\n");
        git.output(repo, "-c", "user.name=Test", "-c", "user.email=test@example.com", "commit", "-q", "-am", "more");
        String head = git.output(repo, "rev-parse", "HEAD").strip();

        CapturedDiff captured = provider.captureRange(repo, base, head);

        assertThat(captured.diffText()).contains("+four");
        assertThat(captured.stats().files()).singleElement()
                .satisfies(f -> assertThat(f.additions()).isEqualTo(1));
        assertThat(captured.digest()).isEqualTo(DiffSnapshotProvider.sha256Prefix(captured.diffText()));
    }

    // ── Test Fixtures ───────────────────────────────────────────────

    private boolean gitAvailable() {
        try {
            return git.run(repo, Set.of(0), "--version").exitCode() == 0;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
