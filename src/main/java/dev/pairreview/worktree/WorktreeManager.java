package dev.pairreview.worktree;

import dev.pairreview.config.WorkspaceProperties;
import dev.pairreview.domain.entity.Worktree;
import dev.pairreview.exception.GitCommandException;
import dev.pairreview.repository.WorktreeRepository;
import dev.pairreview.service.TimeSource;
import dev.pairreview.snapshot.GitCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the isolated checkouts used to analyze pull requests.
 *
 * <p>One worktree per (repository, PR). Reuse refreshes the checkout to the requested head and
 * bumps {@code lastAccessedAt}; worktrees idle longer than the retention window are reclaimed.
 */
@Component
public class WorktreeManager {

    private static final Logger log = LoggerFactory.getLogger(WorktreeManager.class);

    private final WorktreeRepository repository;
    private final GitCommandRunner git;
    private final TimeSource time;
    private final Path baseDir;
    private final Duration retention;

    public WorktreeManager(WorktreeRepository repository, GitCommandRunner git, TimeSource time,
                           WorkspaceProperties properties) {
        this.repository = repository;
        this.git = git;
        this.time = time;
        this.baseDir = properties.worktreeBaseDir();
        this.retention = properties.worktreeRetention();
    }

    /**
     * Returns a worktree checked out at {@code headSha}, creating it from {@code sourceRepo} when no
     * usable one exists.
     */
    public Worktree acquire(String repositoryName, int prNumber, Path sourceRepo, String headSha) {
        Instant now = time.now();
        var existing = repository.findByRepositoryAndPrNumber(repositoryName, prNumber);
        if (existing.isPresent()) {
            Worktree worktree = existing.get();
            Path path = Path.of(worktree.getPath());
            if (Files.isDirectory(path)) {
                git.output(path, "checkout", "--detach", "--force", headSha);
                worktree.markAccessed(headSha, now);
                log.info("Reusing worktree {} for {}#{} at {}", path, repositoryName, prNumber, headSha);
                return repository.save(worktree);
            }
            log.info("Worktree {} for {}#{} is gone; recreating", path, repositoryName, prNumber);
            repository.delete(worktree);
            repository.flush();
        }

        UUID id = UUID.randomUUID();
        Path path = baseDir.resolve(id.toString());
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create worktree directory " + baseDir, e);
        }
        git.output(sourceRepo, "worktree", "add", "--detach", path.toString(), headSha);
        log.info("Created worktree {} for {}#{} at {}", path, repositoryName, prNumber, headSha);
        return repository.save(Worktree.create(id, repositoryName, prNumber,
                sourceRepo.toAbsolutePath().toString(), path.toString(), headSha, now));
    }

    @Scheduled(cron = "${pairreview.workspace.cleanup-cron:0 30 3 * * *}")
    public void scheduledCleanup() {
        CleanupResult result = cleanupStale(retention);
        if (result.cleaned() > 0 || result.failed() > 0) {
            log.info("Worktree cleanup: {} removed, {} failed", result.cleaned(), result.failed());
        }
    }

    /**
     * Removes worktrees not accessed within {@code maxIdle}. Individual failures are counted and
     * reported in the result, never thrown.
     */
    public CleanupResult cleanupStale(Duration maxIdle) {
        Instant cutoff = time.now().minus(maxIdle);
        List<Worktree> stale = repository.findByLastAccessedAtBefore(cutoff);
        int cleaned = 0;
        List<String> errors = new ArrayList<>();
        Set<Path> sources = new LinkedHashSet<>();

        for (Worktree worktree : stale) {
            try {
                removeCheckout(worktree);
                repository.delete(worktree);
                sources.add(Path.of(worktree.getSourcePath()));
                cleaned++;
            } catch (RuntimeException | IOException e) {
                log.warn("Failed to clean up worktree {}: {}", worktree.getPath(), e.getMessage());
                errors.add(worktree.getPath() + ": " + e.getMessage());
            }
        }

        for (Path source : sources) {
            try {
                git.output(source, "worktree", "prune");
            } catch (GitCommandException e) {
                log.warn("git worktree prune failed in {}: {}", source, e.getMessage());
            }
        }
        return new CleanupResult(cleaned, errors.size(), List.copyOf(errors));
    }

    private void removeCheckout(Worktree worktree) throws IOException {
        Path path = Path.of(worktree.getPath());
        Path source = Path.of(worktree.getSourcePath());
        try {
            git.output(source, "worktree", "remove", "--force", path.toString());
        } catch (GitCommandException e) {
            log.debug("git worktree remove failed for {}, deleting directory: {}", path, e.getMessage());
            FileSystemUtils.deleteRecursively(path);
        }
    }

    public record CleanupResult(int cleaned, int failed, List<String> errors) {}
}
