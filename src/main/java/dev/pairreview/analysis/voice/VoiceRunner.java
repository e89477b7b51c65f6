package dev.pairreview.analysis.voice;

/**
 * Runs one voice to completion. Implementations stream intermediate events to the listener and
 * either return a parsed response or throw {@link VoiceInvocationException}.
 */
public interface VoiceRunner {

    VoiceResponse invoke(VoiceRequest request, VoiceEventListener listener);
}
