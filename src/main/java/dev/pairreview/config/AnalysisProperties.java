package dev.pairreview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Orchestration tuning. watchdogWindow is the age after which a RUNNING row is presumed orphaned;
 * progressRetention is how long a finished run's progress stays queryable in memory.
 */
@ConfigurationProperties(prefix = "pairreview.analysis")
public record AnalysisProperties(Duration watchdogWindow, Duration progressRetention,
                                 int subscriberBuffer, Duration voiceTimeout,
                                 double minConfidence, double defaultConfidence) {
    public AnalysisProperties {
        if (watchdogWindow == null) watchdogWindow = Duration.ofMinutes(30);
        if (progressRetention == null) progressRetention = Duration.ofMinutes(2);
        if (subscriberBuffer <= 0) subscriberBuffer = 64;
        if (voiceTimeout == null) voiceTimeout = Duration.ofMinutes(15);
        if (minConfidence <= 0) minConfidence = 0.3;
        if (defaultConfidence <= 0) defaultConfidence = 0.7;
    }

    public static AnalysisProperties defaults() {
        return new AnalysisProperties(null, null, 0, null, 0, 0);
    }
}
