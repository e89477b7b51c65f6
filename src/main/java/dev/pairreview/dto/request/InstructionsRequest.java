package dev.pairreview.dto.request;

import jakarta.validation.constraints.Size;

/** Review-level instructions appended to every analysis prompt. Blank clears them. */
public record InstructionsRequest(@Size(max = 20_000) String instructions) {}
