package dev.pairreview.analysis.voice;

import dev.pairreview.analysis.prompt.PromptType;
import dev.pairreview.domain.valueobject.VoiceSpec;

import java.nio.file.Path;

/**
 * A single voice invocation: who runs, what prompt, from which directory.
 */
public record VoiceRequest(VoiceSpec voice, PromptType promptType, String prompt, Path workingDirectory) {
}
