package dev.pairreview.domain.enums;

/**
 * PR = remote pull request checked out into a worktree, LOCAL = uncommitted working-copy changes.
 */
public enum ReviewKind {
    PR, LOCAL
}
