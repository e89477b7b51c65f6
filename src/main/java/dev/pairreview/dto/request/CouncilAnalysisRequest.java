package dev.pairreview.dto.request;

import dev.pairreview.analysis.council.CouncilConfig;
import jakarta.validation.constraints.NotNull;

public record CouncilAnalysisRequest(@NotNull CouncilConfig config, String instructions) {}
