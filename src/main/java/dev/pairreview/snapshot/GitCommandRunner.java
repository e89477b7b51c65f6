package dev.pairreview.snapshot;

import dev.pairreview.config.WorkspaceProperties;
import dev.pairreview.exception.GitCommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code git} as a subprocess in a given directory and captures its output.
 */
@Component
public class GitCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    private final Duration timeout;
    private final Executor ioExecutor;

    public GitCommandRunner(WorkspaceProperties properties, @Qualifier("processIoExecutor") Executor ioExecutor) {
        this.timeout = properties.gitTimeout();
        this.ioExecutor = ioExecutor;
    }

    /** Runs git and returns stdout, failing on any non-zero exit. */
    public String output(Path workDir, String... args) {
        return run(workDir, Set.of(0), args).stdout();
    }

    /**
     * Runs git and returns the full result, failing unless the exit code is one of
     * {@code acceptedExitCodes}.
     */
    public GitResult run(Path workDir, Set<Integer> acceptedExitCodes, String... args) {
        List<String> argList = Arrays.asList(args);
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(argList);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new GitCommandException(argList, e.getMessage(), e);
        }

        CompletableFuture<String> stdout;
        CompletableFuture<String> stderr;
        try {
            stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()), ioExecutor);
            stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()), ioExecutor);
        } catch (RejectedExecutionException e) {
            process.destroyForcibly();
            throw new GitCommandException(argList, "no reader available for output", e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GitCommandException(argList, "timed out after " + timeout, null);
            }
            GitResult result = new GitResult(process.exitValue(), stdout.get(), stderr.get());
            if (!acceptedExitCodes.contains(result.exitCode())) {
                throw new GitCommandException(argList, result.exitCode(), result.stderr());
            }
            log.trace("git {} in {} → exit {}", argList, workDir, result.exitCode());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new GitCommandException(argList, "interrupted", e);
        } catch (ExecutionException e) {
            throw new GitCommandException(argList, e.getCause().getMessage(), e.getCause());
        }
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public record GitResult(int exitCode, String stdout, String stderr) {

        public List<String> lines() {
            return stdout.lines().filter(line -> !line.isBlank()).toList();
        }
    }
}
