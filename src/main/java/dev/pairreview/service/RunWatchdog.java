package dev.pairreview.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically fails runs left RUNNING past the watchdog window, e.g. by a crashed process.
 */
@Component
public class RunWatchdog {

    private static final Logger log = LoggerFactory.getLogger(RunWatchdog.class);

    private final AnalysisRunService runService;

    public RunWatchdog(AnalysisRunService runService) {
        this.runService = runService;
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${pairreview.analysis.sweep-interval:PT5M}")
    public void sweep() {
        try {
            int failed = runService.failStuckRuns();
            if (failed > 0) {
                log.warn("Watchdog marked {} stuck analysis run(s) as failed", failed);
            }
        } catch (RuntimeException e) {
            log.warn("Watchdog sweep failed: {}", e.getMessage(), e);
        }
    }
}
