package dev.pairreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * pair-review: AI-assisted review of pull requests and local changes.
 *
 * <p>Flow:
 * <pre>
 * open review → DiffSnapshotProvider (diff + digest) → AnalysisOrchestrator
 *   → LevelPipeline per voice (levels 1..3 → consolidation)
 *   → CouncilCoordinator merges voices into the parent run
 *   → ProgressBroadcaster (SSE) + AnalysisRunService (run history)
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PairReviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(PairReviewApplication.class, args);
    }
}
