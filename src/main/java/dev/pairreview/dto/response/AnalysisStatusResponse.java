package dev.pairreview.dto.response;

import dev.pairreview.analysis.progress.ProgressStatus;

/**
 * Stored state of a run plus its live progress while this process still tracks it.
 */
public record AnalysisStatusResponse(AnalysisRunResponse run, ProgressStatus progress) {}
