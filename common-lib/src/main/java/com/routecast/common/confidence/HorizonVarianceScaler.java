package com.routecast.common.confidence;

/**
 * Widens the variance as the forecast horizon grows:
 * {@code variance = base × (1 + step × (weeksAhead − 1))}, step 0.2 by default.
 * Horizon 1 returns the base unchanged.
 */
public class HorizonVarianceScaler {

    private final double step;

    public HorizonVarianceScaler(double step) {
        if (!Double.isFinite(step) || step < 0.0) {
            throw new IllegalArgumentException("step must be finite and >= 0, got " + step);
        }
        this.step = step;
    }

    public double scale(double baseVariancePct, int weeksAhead) {
        if (weeksAhead < 1) {
            throw new IllegalArgumentException("weeksAhead must be >= 1, got " + weeksAhead);
        }
        if (weeksAhead == 1) {
            return baseVariancePct;
        }
        return baseVariancePct * (1.0 + step * (weeksAhead - 1));
    }
}
