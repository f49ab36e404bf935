package com.routecast.scheduler.job;

import com.routecast.scheduler.client.PerformanceClient;
import com.routecast.scheduler.strategy.CycleTempoStrategy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Weekly tracking loop:
 * <pre>
 *   delay(interval) → POST /api/v1/routing/cycles → pick next interval → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose {@code subscribe} callback schedules the
 * next one. Failed cycles are never fatal to the loop; they only shorten the next delay
 * to the retry interval.
 */
@Component
public class TrackingCycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(TrackingCycleScheduler.class);

    private final PerformanceClient performanceClient;
    private final CycleTempoStrategy strategy;

    @Value("${scheduler.enabled:true}")
    private boolean enabled = true;

    public TrackingCycleScheduler(PerformanceClient performanceClient, CycleTempoStrategy strategy) {
        this.performanceClient = performanceClient;
        this.strategy          = strategy;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Tracking cycle scheduler disabled");
            return;
        }
        Duration initial = strategy.initial();
        log.info("Tracking cycle scheduler started. firstCycleInSeconds={}", initial.toSeconds());
        scheduleNextCycle(initial);
    }

    /**
     * Runs one cycle now and resolves the delay before the next one. Never signals an error.
     */
    public Mono<Duration> runOnce() {
        String traceId = UUID.randomUUID().toString();
        log.info("Triggering tracking cycle. traceId={}", traceId);
        return performanceClient.runCycle(traceId)
            .map(report -> {
                Duration next = strategy.resolve(report);
                log.info("TRACKING_CYCLE_DONE traceId={} version={} switched={} failed={} nextIntervalSeconds={}",
                         traceId, report.tableVersion(), report.switched(), report.failed(), next.toSeconds());
                return next;
            })
            .switchIfEmpty(Mono.fromSupplier(strategy::afterConflict))
            .onErrorResume(e -> {
                Duration retry = strategy.afterFailure();
                log.warn("Tracking cycle failed. traceId={} retryInSeconds={}", traceId, retry.toSeconds());
                return Mono.just(retry);
            });
    }

    private void scheduleNextCycle(Duration delay) {
        Mono.delay(delay)
            .then(Mono.defer(this::runOnce))
            .subscribe(
                this::scheduleNextCycle,
                err -> {
                    log.error("Tracking cycle loop error; rescheduling with retry interval", err);
                    scheduleNextCycle(strategy.afterFailure());
                }
            );
    }
}
