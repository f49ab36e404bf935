package com.routecast.common.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ForecastErrorCalculatorTest {

    private static final double PENALTY = 999.0;

    @Test
    @DisplayName("signed error relative to actual")
    void signedError() {
        assertEquals(-10.0, ForecastErrorCalculator.errorPct(90, 100, PENALTY), 1e-9);
        assertEquals(50.0, ForecastErrorCalculator.errorPct(150, 100, PENALTY), 1e-9);
    }

    @Test
    @DisplayName("zero actual and zero forecast → 0")
    void zeroZero() {
        assertEquals(0.0, ForecastErrorCalculator.errorPct(0, 0, PENALTY));
    }

    @Test
    @DisplayName("zero actual and nonzero forecast → configured penalty, never infinity")
    void zeroActualPenalty() {
        assertEquals(PENALTY, ForecastErrorCalculator.errorPct(3, 0, PENALTY));
        assertEquals(250.0, ForecastErrorCalculator.absErrorPct(3, 0, 250.0));
    }

    @Test
    @DisplayName("absolute error drops the sign")
    void absolute() {
        assertEquals(10.0, ForecastErrorCalculator.absErrorPct(90, 100, PENALTY), 1e-9);
    }
}
