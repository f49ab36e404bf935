package com.routecast.performance.provider;

import com.routecast.common.model.Period;
import com.routecast.common.model.RouteObservation;
import com.routecast.common.provider.ModelRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.routecast.performance.provider.BuiltinForecastModels.*;
import static org.junit.jupiter.api.Assertions.*;

class BuiltinForecastModelsTest {

    private static final Period TARGET = Period.of(10, 2025);

    private static RouteObservation obs(int week, int year, double quantity) {
        return new RouteObservation(Period.of(week, year), quantity);
    }

    /** 2023-W10 = 80, 2024-W10 = 100, then 2025 W1..W8 = 10, 20, ... 80. */
    private static List<RouteObservation> history() {
        List<RouteObservation> history = new ArrayList<>();
        history.add(obs(10, 2023, 80));
        history.add(obs(10, 2024, 100));
        for (int w = 1; w <= 8; w++) {
            history.add(obs(w, 2025, w * 10.0));
        }
        return history;
    }

    @Test
    @DisplayName("registerAll registers every built-in method")
    void registersAll() {
        ModelRegistry registry = registerAll(ModelRegistry.builder()).build();

        assertEquals(11, registry.size());
        assertTrue(registry.contains(HISTORICAL_BASELINE));
        assertTrue(registry.contains(HYBRID_WEEK_BLEND));
    }

    @Nested
    @DisplayName("Forecast values")
    class Values {

        @Test
        @DisplayName("recent means use the latest observations only")
        void recentMeans() {
            assertEquals(75.0, recentMean(2).forecast(history(), TARGET, "PARCEL"), 1e-9);
            assertEquals(65.0, recentMean(4).forecast(history(), TARGET, "PARCEL"), 1e-9);
            assertEquals(45.0, recentMean(8).forecast(history(), TARGET, "PARCEL"), 1e-9);
        }

        @Test
        @DisplayName("calendar methods look at the target week in earlier years")
        void calendarMethods() {
            assertEquals(90.0, historicalBaseline(history(), TARGET, "PARCEL"), 1e-9);
            assertEquals(100.0, sameWeekLastYear(history(), TARGET, "PARCEL"), 1e-9);
            assertEquals(90.0, weekSpecific(history(), TARGET, "PARCEL"), 1e-9);
        }

        @Test
        @DisplayName("baseline falls back to the mean of all history without a matching week")
        void baselineFallback() {
            List<RouteObservation> history = List.of(obs(1, 2025, 10), obs(2, 2025, 30));
            assertEquals(20.0, historicalBaseline(history, TARGET, "PARCEL"), 1e-9);
        }

        @Test
        @DisplayName("trend factor is clamped to 1.5")
        void trendClamped() {
            // recent 65, prior 25 → 2.6 clamped
            assertEquals(97.5, trendAdjusted(history(), TARGET, "PARCEL"), 1e-9);
        }

        @Test
        @DisplayName("trend needs eight weeks, otherwise recent mean")
        void trendShortHistory() {
            List<RouteObservation> history = List.of(obs(1, 2025, 10), obs(2, 2025, 20),
                                                     obs(3, 2025, 30), obs(4, 2025, 40));
            assertEquals(25.0, trendAdjusted(history, TARGET, "PARCEL"), 1e-9);
        }

        @Test
        void priorWeekAndMedian() {
            assertEquals(80.0, priorWeek(history(), TARGET, "PARCEL"), 1e-9);
            assertEquals(65.0, medianRecent4(history(), TARGET, "PARCEL"), 1e-9);
        }

        @Test
        @DisplayName("exponential smoothing with alpha 0.3")
        void smoothing() {
            List<RouteObservation> history = List.of(obs(1, 2025, 10), obs(2, 2025, 20));
            assertEquals(13.0, exponentialSmoothing(history, TARGET, "PARCEL"), 1e-9);
        }

        @Test
        @DisplayName("hybrid blends 70% week-specific with 30% recent mean")
        void hybrid() {
            assertEquals(82.5, hybridWeekBlend(history(), TARGET, "PARCEL"), 1e-9);
        }
    }

    @Nested
    @DisplayName("Insufficient history")
    class Insufficient {

        @Test
        @DisplayName("empty history yields no forecast rather than zero")
        void emptyHistory() {
            assertThrows(IllegalStateException.class, () -> priorWeek(List.of(), TARGET, "PARCEL"));
            assertThrows(IllegalStateException.class, () -> historicalBaseline(List.of(), TARGET, "PARCEL"));
            assertThrows(IllegalStateException.class, () -> exponentialSmoothing(List.of(), TARGET, "PARCEL"));
        }

        @Test
        @DisplayName("week-specific needs two earlier years")
        void weekSpecificNeedsTwoYears() {
            List<RouteObservation> history = List.of(obs(10, 2024, 100), obs(1, 2025, 10));
            assertThrows(IllegalStateException.class, () -> weekSpecific(history, TARGET, "PARCEL"));
            assertThrows(IllegalStateException.class, () -> hybridWeekBlend(history, TARGET, "PARCEL"));
        }

        @Test
        void recentMeanNeedsFullWindow() {
            List<RouteObservation> history = List.of(obs(1, 2025, 10), obs(2, 2025, 20), obs(3, 2025, 30));
            assertThrows(IllegalStateException.class, () -> recentMean(4).forecast(history, TARGET, "PARCEL"));
        }

        @Test
        void sameWeekLastYearMissing() {
            List<RouteObservation> history = List.of(obs(10, 2023, 80));
            assertThrows(IllegalStateException.class, () -> sameWeekLastYear(history, TARGET, "PARCEL"));
        }
    }
}
