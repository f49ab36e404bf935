package com.routecast.common.ledger;

/**
 * Signed and absolute percentage error of a forecast against its actual.
 *
 * <pre>
 *   actual &gt; 0                  → (forecast − actual) / actual × 100
 *   actual == 0, forecast == 0  → 0
 *   actual == 0, forecast &gt; 0   → zeroActualPenaltyPct
 * </pre>
 *
 * <p>The zero-actual branch never divides, so no NaN or infinity reaches the ledger.
 */
public final class ForecastErrorCalculator {

    private ForecastErrorCalculator() {}

    public static double errorPct(double forecast, double actual, double zeroActualPenaltyPct) {
        if (actual > 0.0) {
            return (forecast - actual) / actual * 100.0;
        }
        return forecast == 0.0 ? 0.0 : zeroActualPenaltyPct;
    }

    public static double absErrorPct(double forecast, double actual, double zeroActualPenaltyPct) {
        return Math.abs(errorPct(forecast, actual, zeroActualPenaltyPct));
    }
}
