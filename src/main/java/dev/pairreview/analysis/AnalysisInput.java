package dev.pairreview.analysis;

import dev.pairreview.domain.valueobject.RunInstructions;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable view of what a run analyzes, detached from the persistence session so it can be
 * handed to worker threads.
 */
public record AnalysisInput(long reviewId, String repository, String headSha, Path workingDirectory,
                            String diffText, List<String> changedFiles, RunInstructions instructions) {

    public AnalysisInput {
        changedFiles = changedFiles == null ? List.of() : List.copyOf(changedFiles);
        if (instructions == null) instructions = RunInstructions.none();
    }
}
