package dev.pairreview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Git working-copy settings shared by the diff snapshot provider and the worktree manager.
 */
@ConfigurationProperties(prefix = "pairreview.workspace")
public record WorkspaceProperties(Path worktreeBaseDir, Duration worktreeRetention,
                                  long maxUntrackedFileBytes, Duration gitTimeout) {
    public WorkspaceProperties {
        if (worktreeBaseDir == null)
            worktreeBaseDir = Path.of(System.getProperty("user.home"), ".pair-review", "worktrees");
        if (worktreeRetention == null) worktreeRetention = Duration.ofDays(7);
        if (maxUntrackedFileBytes <= 0) maxUntrackedFileBytes = 1024 * 1024;
        if (gitTimeout == null) gitTimeout = Duration.ofSeconds(60);
    }
}
