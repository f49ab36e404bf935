package com.routecast.common.ledger;

import com.routecast.common.config.EngineConfig;
import com.routecast.common.exception.LedgerUnavailableException;
import com.routecast.common.model.EvaluationBatch;
import com.routecast.common.model.EvaluationBatch.RouteOutcome;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Period;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.routecast.common.testutil.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PerformanceLedgerTest {

    private InMemoryLedgerStore store;
    private PerformanceLedger ledger;

    @BeforeEach
    void setUp() {
        store  = store();
        ledger = ledger(store);
    }

    @Nested
    @DisplayName("record()")
    class RecordTests {

        @Test
        @DisplayName("computes signed and absolute error")
        void computesErrors() {
            PerformanceRecord r = ledger.record(ROUTE_R, week(1), "A", 90, 100);
            assertEquals(-10.0, r.errorPct(), 1e-9);
            assertEquals(10.0, r.absErrorPct(), 1e-9);
            assertEquals(FIXED_CLOCK.instant(), r.recordedAt());
        }

        @Test
        @DisplayName("recording the same key twice leaves exactly one identical record")
        void idempotent() {
            PerformanceRecord first = ledger.record(ROUTE_R, week(1), "A", 90, 100);
            ledger.record(ROUTE_R, week(1), "A", 90, 100);

            assertEquals(1, store.size());
            assertEquals(List.of(first), store.recordsFor(ROUTE_R));
        }

        @Test
        @DisplayName("re-recording with new values overwrites")
        void overwrite() {
            ledger.record(ROUTE_R, week(1), "A", 90, 100);
            ledger.record(ROUTE_R, week(1), "A", 120, 100);

            assertEquals(1, store.size());
            assertEquals(20.0, store.recordsFor(ROUTE_R).get(0).absErrorPct(), 1e-9);
        }

        @Test
        @DisplayName("negative forecast is clamped to zero")
        void negativeForecastClamped() {
            PerformanceRecord r = ledger.record(ROUTE_R, week(1), "A", -5, 100);
            assertEquals(0.0, r.forecastValue());
            assertEquals(100.0, r.absErrorPct(), 1e-9);
        }

        @Test
        @DisplayName("negative actual is rejected")
        void negativeActual() {
            assertThrows(IllegalArgumentException.class, () -> ledger.record(ROUTE_R, week(1), "A", 5, -1));
        }

        @Test
        @DisplayName("storage failure surfaces as LedgerUnavailableException")
        void storageFailure() {
            LedgerStore broken = new InMemoryLedgerStore() {
                @Override
                public void upsert(PerformanceRecord record) {
                    throw new IllegalStateException("disk full");
                }
            };
            PerformanceLedger failing =
                new PerformanceLedger(broken, new BatchEvaluator(EngineConfig.defaults(), FIXED_CLOCK));
            assertThrows(LedgerUnavailableException.class,
                () -> failing.record(ROUTE_R, week(1), "A", 90, 100));
        }
    }

    @Nested
    @DisplayName("recordBatch()")
    class BatchTests {

        private EvaluationBatch batch() {
            Map<String, Double> withNaN = new HashMap<>();
            withNaN.put("A", 110.0);
            withNaN.put("B", Double.NaN);
            withNaN.put("C", null);
            return new EvaluationBatch(week(3), Arrays.asList(
                new RouteOutcome(ROUTE_R, 100.0, withNaN),
                new RouteOutcome(ROUTE_S, null, Map.of("A", 10.0, "B", 12.0))));
        }

        @Test
        @DisplayName("route without actual is excluded, not recorded as zero")
        void missingActualExcluded() {
            LedgerBatch result = ledger.recordBatch(batch());

            assertEquals(List.of(ROUTE_S.routeKey()), result.missingActualRouteKeys());
            assertTrue(store.recordsFor(ROUTE_S).isEmpty());
        }

        @Test
        @DisplayName("NaN or missing forecasts are dropped and counted")
        void invalidForecastsRejected() {
            LedgerBatch result = ledger.recordBatch(batch());

            assertEquals(2, result.forecastsRejected());
            assertEquals(1, result.records().size());
            assertEquals("A", result.records().get(0).modelId());
        }

        @Test
        @DisplayName("invoking the same batch twice leaves the ledger unchanged")
        void retrySafe() {
            ledger.recordBatch(batch());
            LedgerSnapshot once = store.snapshot();
            ledger.recordBatch(batch());

            assertEquals(once.size(), store.size());
            assertEquals(once.recordsFor(ROUTE_R), store.snapshot().recordsFor(ROUTE_R));
        }

        @Test
        @DisplayName("report counts received, recorded and missing routes")
        void report() {
            var report = ledger.recordBatch(batch()).toReport();

            assertEquals(Period.of(3, 2025), report.period());
            assertEquals(2, report.routesReceived());
            assertEquals(1, report.routesRecorded());
            assertEquals(1, report.routesMissingActual());
            assertEquals(1, report.recordsWritten());
        }
    }

    @Test
    @DisplayName("concurrent upserts of the same keys never duplicate")
    void concurrentUpserts() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 200; i++) {
            int week = (i % 4) + 1;
            pool.submit(() -> ledger.record(ROUTE_R, week(week), "A", 90, 100));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(4, store.size());
        assertEquals(4, store.snapshot().size());
    }
}
