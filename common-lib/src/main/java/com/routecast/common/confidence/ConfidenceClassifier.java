package com.routecast.common.confidence;

import com.routecast.common.config.EngineConfig;
import com.routecast.common.config.VarianceMethod;
import com.routecast.common.model.ConfidenceTier;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.model.TierAssessment;

/**
 * Maps an error magnitude to a {@link ConfidenceTier} and a single-period variance.
 *
 * <pre>
 *   error &lt; highCutoff (20)                 → HIGH      min(error, highVarianceCap (10))
 *   highCutoff ≤ error &lt; mediumCutoff (50)  → MEDIUM    mediumVariance (25)
 *   error ≥ mediumCutoff, or unavailable     → LOW       lowVariance (50)
 *   no routing entry                         → NEW_ROUTE newRouteVariance (100)
 * </pre>
 *
 * <p>Intervals follow the tier rather than the raw error, so one lucky period
 * cannot produce a spuriously tight interval. Pure and thread-safe.
 */
public class ConfidenceClassifier {

    private final EngineConfig config;

    public ConfidenceClassifier(EngineConfig config) {
        this.config = config;
    }

    /**
     * @param absErrorPct absolute error in percent; NaN, infinite or negative values
     *                    are treated as unavailable
     */
    public TierAssessment classify(double absErrorPct) {
        if (!Double.isFinite(absErrorPct) || absErrorPct < 0.0) {
            return new TierAssessment(ConfidenceTier.LOW, config.lowVariancePct());
        }
        if (absErrorPct < config.highCutoffPct()) {
            return new TierAssessment(ConfidenceTier.HIGH, Math.min(absErrorPct, config.highVarianceCapPct()));
        }
        if (absErrorPct < config.mediumCutoffPct()) {
            return new TierAssessment(ConfidenceTier.MEDIUM, config.mediumVariancePct());
        }
        return new TierAssessment(ConfidenceTier.LOW, config.lowVariancePct());
    }

    public TierAssessment newRoute() {
        return new TierAssessment(ConfidenceTier.NEW_ROUTE, config.newRouteVariancePct());
    }

    /**
     * Single-period variance for an emitted forecast, honouring the configured
     * {@link VarianceMethod}.
     *
     * @param entry the route's routing entry, or {@code null} for a new route
     */
    public TierAssessment assess(RoutingEntry entry) {
        if (entry == null) {
            return newRoute();
        }
        double error = entry.historicalErrorPct();
        if (config.varianceMethod() == VarianceMethod.HISTORICAL && Double.isFinite(error)) {
            return new TierAssessment(entry.confidenceTier(), Math.abs(error));
        }
        return new TierAssessment(entry.confidenceTier(), tierVariance(entry.confidenceTier(), error));
    }

    private double tierVariance(ConfidenceTier tier, double errorPct) {
        return switch (tier) {
            case HIGH      -> Double.isFinite(errorPct)
                                  ? Math.min(Math.abs(errorPct), config.highVarianceCapPct())
                                  : config.highVarianceCapPct();
            case MEDIUM    -> config.mediumVariancePct();
            case LOW       -> config.lowVariancePct();
            case NEW_ROUTE -> config.newRouteVariancePct();
        };
    }
}
