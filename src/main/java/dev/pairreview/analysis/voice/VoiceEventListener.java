package dev.pairreview.analysis.voice;

@FunctionalInterface
public interface VoiceEventListener {

    void onEvent(VoiceEvent event);
}
