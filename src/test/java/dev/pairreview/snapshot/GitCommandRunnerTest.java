package dev.pairreview.snapshot;

import dev.pairreview.config.WorkspaceProperties;
import dev.pairreview.exception.GitCommandException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GitCommandRunnerTest {

    @TempDir
    Path dir;

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final WorkspaceProperties properties =
            new WorkspaceProperties(null, null, 0, Duration.ofSeconds(20));

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("both output streams are drained on the supplied executor")
    void readsOutputOnSuppliedExecutor() {
        AtomicInteger tasks = new AtomicInteger();
        Executor counting = command -> {
            tasks.incrementAndGet();
            pool.execute(command);
        };
        GitCommandRunner git = new GitCommandRunner(properties, counting);
        assumeTrue(gitAvailable(git), "git is not installed");
        tasks.set(0);

        String version = git.output(dir, "--version");

        assertThat(version).startsWith("git version");
        assertThat(tasks).hasValue(2);
    }

    @Test
    @DisplayName("a saturated reader pool fails the command instead of leaving its pipes unread")
    void saturatedExecutorFailsCommand() {
        assumeTrue(gitAvailable(new GitCommandRunner(properties, pool)), "git is not installed");
        Executor saturated = command -> {
            throw new RejectedExecutionException("pool is full");
        };
        GitCommandRunner git = new GitCommandRunner(properties, saturated);

        assertThatThrownBy(() -> git.output(dir, "--version"))
                .isInstanceOf(GitCommandException.class)
                .hasMessageContaining("no reader available");
    }

    private boolean gitAvailable(GitCommandRunner git) {
        try {
            return git.run(dir, Set.of(0), "--version").exitCode() == 0;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
