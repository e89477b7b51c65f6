package dev.pairreview.analysis.voice;

/**
 * A voice failed: the provider is unknown, the process could not start, timed out, exited
 * non-zero, or produced output that holds no suggestion JSON.
 */
public class VoiceInvocationException extends RuntimeException {

    private final String voiceKey;

    public VoiceInvocationException(String voiceKey, String message) {
        super(message);
        this.voiceKey = voiceKey;
    }

    public VoiceInvocationException(String voiceKey, String message, Throwable cause) {
        super(message, cause);
        this.voiceKey = voiceKey;
    }

    public String getVoiceKey() {
        return voiceKey;
    }
}
