package com.routecast.scheduler.strategy;

import com.routecast.common.model.CycleReport;

import java.time.Duration;

/**
 * Picks the delay before the next tracking cycle.
 *
 * <ul>
 *   <li>cycle completed          : the regular cycle interval</li>
 *   <li>every evaluated route failed, or the call failed : the retry interval</li>
 *   <li>publish lost to a concurrent cycle : the regular cycle interval</li>
 * </ul>
 */
public final class CycleTempoStrategy {

    public static final Duration DEFAULT_CYCLE_INTERVAL = Duration.ofDays(7);
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofHours(1);

    private final Duration cycleInterval;
    private final Duration retryInterval;

    public CycleTempoStrategy(Duration cycleInterval, Duration retryInterval) {
        if (cycleInterval == null || cycleInterval.isNegative() || cycleInterval.isZero()) {
            throw new IllegalArgumentException("cycle interval must be positive, got " + cycleInterval);
        }
        if (retryInterval == null || retryInterval.isNegative() || retryInterval.isZero()) {
            throw new IllegalArgumentException("retry interval must be positive, got " + retryInterval);
        }
        this.cycleInterval = cycleInterval;
        this.retryInterval = retryInterval;
    }

    public static CycleTempoStrategy defaults() {
        return new CycleTempoStrategy(DEFAULT_CYCLE_INTERVAL, DEFAULT_RETRY_INTERVAL);
    }

    public Duration resolve(CycleReport report) {
        boolean allFailed = report.routesEvaluated() > 0 && report.failed() == report.routesEvaluated();
        return allFailed ? retryInterval : cycleInterval;
    }

    public Duration afterConflict() {
        return cycleInterval;
    }

    public Duration afterFailure() {
        return retryInterval;
    }

    /** Delay before the very first cycle of this process. */
    public Duration initial() {
        return retryInterval;
    }
}
