package dev.pairreview.analysis.voice;

/**
 * One streamed event from a running voice.
 */
public record VoiceEvent(Kind kind, String content) {

    public enum Kind { TEXT, TOOL_USE }

    public static VoiceEvent text(String content) {
        return new VoiceEvent(Kind.TEXT, content);
    }

    public static VoiceEvent toolUse(String toolName) {
        return new VoiceEvent(Kind.TOOL_USE, toolName);
    }

    /** Short human-readable form used as a progress message. */
    public String describe() {
        return switch (kind) {
            case TOOL_USE -> "Using " + content;
            case TEXT -> content.length() > 120 ? content.substring(0, 117) + "..." : content;
        };
    }
}
