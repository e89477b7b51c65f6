package dev.pairreview.service;

import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunWatchdogTest {

    @Test
    void sweepFailsStuckRuns() {
        AnalysisRunService runService = mock(AnalysisRunService.class);
        when(runService.failStuckRuns()).thenReturn(2);

        new RunWatchdog(runService).sweep();

        verify(runService).failStuckRuns();
    }

    @Test
    void sweepSurvivesStoreErrors() {
        AnalysisRunService runService = mock(AnalysisRunService.class);
        when(runService.failStuckRuns()).thenThrow(new QueryTimeoutException("slow"));

        assertThatCode(() -> new RunWatchdog(runService).sweep()).doesNotThrowAnyException();
    }
}
