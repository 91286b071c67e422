package com.chaincollector.unit.scheduler;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.chaincollector.collector.CollectionOrchestrator;
import com.chaincollector.collector.CycleReport;
import com.chaincollector.error.ErrorRouter;
import com.chaincollector.scheduler.CollectionScheduler;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CollectionSchedulerTest {

    @Mock
    private CollectionOrchestrator orchestrator;

    @Mock
    private ErrorRouter errorRouter;

    private CollectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new CollectionScheduler(orchestrator, errorRouter);
        when(orchestrator.runCycle()).thenReturn(CycleReport.builder()
                .cycleId(1)
                .elapsed(Duration.ZERO)
                .outcomes(Map.of())
                .build());
    }

    @Test
    @DisplayName("Runs a cycle on every tick under normal pressure")
    void everyTick() {
        scheduler.tick();
        scheduler.tick();
        scheduler.tick();

        verify(orchestrator, times(3)).runCycle();
    }

    @Test
    @DisplayName("Skips every other tick while slow cycles are active")
    void alternateTicks() {
        when(orchestrator.isSlowCyclesActive()).thenReturn(true);

        for (int i = 0; i < 4; i++) {
            scheduler.tick();
        }

        verify(orchestrator, times(2)).runCycle();
    }

    @Test
    @DisplayName("A failing cycle is routed and the next tick still runs")
    void failureRouted() {
        IllegalStateException failure = new IllegalStateException("executor rejected");
        when(orchestrator.runCycle()).thenThrow(failure).thenReturn(CycleReport.builder()
                .cycleId(2)
                .elapsed(Duration.ZERO)
                .outcomes(Map.of())
                .build());

        scheduler.tick();
        scheduler.tick();

        verify(errorRouter).handleCollectorError(eq(failure), eq("scheduler"), isNull(), isNull());
        verify(orchestrator, times(2)).runCycle();
        verify(errorRouter, never()).handle(any(), any(), any());
    }
}
