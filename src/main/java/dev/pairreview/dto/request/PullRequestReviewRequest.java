package dev.pairreview.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * @param sourceRepoPath local clone the PR worktree is created from; it must contain both commits
 */
public record PullRequestReviewRequest(
        @NotBlank String repository,
        @Positive int prNumber,
        @NotBlank String sourceRepoPath,
        @NotBlank String baseSha,
        @NotBlank String headSha
) {}
