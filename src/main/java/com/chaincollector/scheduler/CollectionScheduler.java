package com.chaincollector.scheduler;

import com.chaincollector.collector.CollectionOrchestrator;
import com.chaincollector.collector.CycleReport;
import com.chaincollector.error.ErrorRouter;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives collection cycles at {@code collector.cycle-interval} (fixed delay, so cycles never
 * overlap). While memory pressure asks for slow cycles every other tick is skipped.
 */
@Component
public class CollectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(CollectionScheduler.class);

    private final CollectionOrchestrator orchestrator;
    private final ErrorRouter errorRouter;
    private final AtomicBoolean skippedLastTick = new AtomicBoolean();

    public CollectionScheduler(CollectionOrchestrator orchestrator, ErrorRouter errorRouter) {
        this.orchestrator = orchestrator;
        this.errorRouter = errorRouter;
    }

    @Scheduled(fixedDelayString = "${collector.cycle-interval:60s}", initialDelayString = "${collector.initial-delay:5s}")
    public void tick() {
        if (orchestrator.isSlowCyclesActive() && !skippedLastTick.get()) {
            skippedLastTick.set(true);
            log.info("Slow cycles active, skipping this tick");
            return;
        }
        skippedLastTick.set(false);
        try {
            CycleReport report = orchestrator.runCycle();
            log.debug("Cycle {} wrote {} options", report.getCycleId(), report.totalOptionsWritten());
        } catch (RuntimeException e) {
            errorRouter.handleCollectorError(e, "scheduler", null, null);
        }
    }

    boolean isSkippedLastTick() {
        return skippedLastTick.get();
    }
}
