package com.routecast.scheduler.job;

import com.routecast.common.model.CycleReport;
import com.routecast.scheduler.client.PerformanceClient;
import com.routecast.scheduler.strategy.CycleTempoStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrackingCycleSchedulerTest {

    @Mock private PerformanceClient performanceClient;

    private TrackingCycleScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TrackingCycleScheduler(performanceClient,
                                               new CycleTempoStrategy(Duration.ofDays(7), Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("successful cycle schedules the next one a week later")
    void success() {
        when(performanceClient.runCycle(anyString()))
            .thenReturn(Mono.just(new CycleReport(2, 4, 1, 3, 0, 0, 0, 0)));

        StepVerifier.create(scheduler.runOnce())
            .expectNext(Duration.ofDays(7))
            .verifyComplete();
    }

    @Test
    @DisplayName("failed call retries at the retry interval instead of erroring")
    void failure() {
        when(performanceClient.runCycle(anyString()))
            .thenReturn(Mono.error(new IOException("connection refused")));

        StepVerifier.create(scheduler.runOnce())
            .expectNext(Duration.ofMinutes(30))
            .verifyComplete();
    }

    @Test
    @DisplayName("superseded cycle keeps the weekly cadence")
    void superseded() {
        when(performanceClient.runCycle(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(scheduler.runOnce())
            .expectNext(Duration.ofDays(7))
            .verifyComplete();
    }

    @Test
    @DisplayName("each cycle carries a fresh trace id")
    void traceIds() {
        when(performanceClient.runCycle(anyString())).thenReturn(Mono.empty());

        scheduler.runOnce().block();
        scheduler.runOnce().block();

        verify(performanceClient, times(2)).runCycle(argThat(id -> id != null && !id.isBlank()));
    }
}
