package com.chaincollector.domain.enums;

import java.time.LocalTime;

/**
 * NSE market phases based on time of day, with their time boundaries.
 *
 * <pre>
 * 09:00-09:08  PRE_OPEN
 * 09:08-09:15  PRE_OPEN_ORDER_MATCHING
 * 09:15-15:30  NORMAL                  (collection window)
 * 15:30-15:40  CLOSING
 * 15:40-16:00  POST_CLOSE
 * 16:00-09:00  CLOSED
 * </pre>
 *
 * <p>Option-chain snapshots are only collected during NORMAL.
 */
public enum MarketPhase {
    PRE_OPEN(LocalTime.of(9, 0), LocalTime.of(9, 8)),
    PRE_OPEN_ORDER_MATCHING(LocalTime.of(9, 8), LocalTime.of(9, 15)),
    NORMAL(LocalTime.of(9, 15), LocalTime.of(15, 30)),
    CLOSING(LocalTime.of(15, 30), LocalTime.of(15, 40)),
    POST_CLOSE(LocalTime.of(15, 40), LocalTime.of(16, 0)),
    CLOSED(LocalTime.of(16, 0), LocalTime.of(9, 0));

    private final LocalTime startTime;
    private final LocalTime endTime;

    MarketPhase(LocalTime startTime, LocalTime endTime) {
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }
}
