package com.routecast.common.confidence;

import com.routecast.common.config.EngineConfig;
import com.routecast.common.config.VarianceMethod;
import com.routecast.common.model.ConfidenceTier;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.model.TierAssessment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.routecast.common.testutil.LedgerFixtures.ROUTE_R;
import static org.junit.jupiter.api.Assertions.*;

class ConfidenceClassifierTest {

    private final ConfidenceClassifier classifier = new ConfidenceClassifier(EngineConfig.defaults());

    @Nested
    @DisplayName("classify()")
    class ClassifyTests {

        @ParameterizedTest(name = "error {0} → {1} with variance {2}")
        @CsvSource({
            "0.0,   HIGH,   0.0",
            "7.5,   HIGH,   7.5",
            "15.0,  HIGH,   10.0",
            "20.0,  MEDIUM, 25.0",
            "49.99, MEDIUM, 25.0",
            "50.0,  LOW,    50.0",
            "999.0, LOW,    50.0"
        })
        void tierTable(double error, ConfidenceTier tier, double variance) {
            TierAssessment a = classifier.classify(error);
            assertEquals(tier, a.tier());
            assertEquals(variance, a.variancePct(), 1e-9);
        }

        @Test
        @DisplayName("unavailable error is LOW")
        void unavailable() {
            assertEquals(ConfidenceTier.LOW, classifier.classify(Double.NaN).tier());
            assertEquals(ConfidenceTier.LOW, classifier.classify(-1.0).tier());
        }

        @Test
        @DisplayName("a larger error never yields a better tier")
        void monotonic() {
            ConfidenceTier previous = ConfidenceTier.HIGH;
            for (double e = 0.0; e <= 200.0; e += 0.25) {
                ConfidenceTier tier = classifier.classify(e).tier();
                assertFalse(previous.isWorseThan(tier), "tier improved at error " + e);
                previous = tier;
            }
        }
    }

    @Nested
    @DisplayName("assess()")
    class AssessTests {

        @Test
        @DisplayName("no entry → NEW_ROUTE at 100%")
        void newRoute() {
            TierAssessment a = classifier.assess(null);
            assertEquals(ConfidenceTier.NEW_ROUTE, a.tier());
            assertEquals(100.0, a.variancePct());
        }

        @Test
        @DisplayName("confidence method caps HIGH variance")
        void confidenceMethod() {
            RoutingEntry entry = new RoutingEntry(ROUTE_R, "A", 14.0, ConfidenceTier.HIGH, null);
            assertEquals(10.0, classifier.assess(entry).variancePct(), 1e-9);
        }

        @Test
        @DisplayName("historical method uses the raw rolling error")
        void historicalMethod() {
            ConfidenceClassifier historical = new ConfidenceClassifier(
                EngineConfig.builder().varianceMethod(VarianceMethod.HISTORICAL).build());
            RoutingEntry entry = new RoutingEntry(ROUTE_R, "A", 34.0, ConfidenceTier.MEDIUM, null);

            TierAssessment a = historical.assess(entry);
            assertEquals(ConfidenceTier.MEDIUM, a.tier());
            assertEquals(34.0, a.variancePct(), 1e-9);
        }
    }

    @Nested
    @DisplayName("intervals and horizons")
    class IntervalTests {

        private final HorizonVarianceScaler scaler = new HorizonVarianceScaler(0.2);

        @Test
        @DisplayName("horizon 1 keeps the base variance, horizon 6 doubles it")
        void scaling() {
            assertEquals(10.0, scaler.scale(10.0, 1), 1e-9);
            assertEquals(12.0, scaler.scale(10.0, 2), 1e-9);
            assertEquals(20.0, scaler.scale(10.0, 6), 1e-9);
        }

        @Test
        @DisplayName("horizon below one is rejected")
        void invalidHorizon() {
            assertThrows(IllegalArgumentException.class, () -> scaler.scale(10.0, 0));
        }

        @Test
        @DisplayName("interval contains the forecast and never goes negative")
        void containment() {
            for (double v : new double[] {0.0, 7.5, 25.0, 50.0, 100.0, 150.0}) {
                VarianceInterval i = VarianceInterval.around(80.0, v);
                assertTrue(i.low() >= 0.0);
                assertTrue(i.low() <= 80.0 && 80.0 <= i.high());
                assertEquals(80.0 * v / 100.0, i.variancePieces(), 1e-9);
            }
            assertEquals(0.0, VarianceInterval.around(80.0, 150.0).low());
        }
    }
}
