package com.routecast.common.emission;

import com.routecast.common.aggregation.RollingPerformanceAggregator;
import com.routecast.common.confidence.ConfidenceClassifier;
import com.routecast.common.confidence.HorizonVarianceScaler;
import com.routecast.common.confidence.VarianceInterval;
import com.routecast.common.config.EngineConfig;
import com.routecast.common.ensemble.EnsembleFallback;
import com.routecast.common.ensemble.EnsembleResult;
import com.routecast.common.ledger.LedgerView;
import com.routecast.common.model.ConfidenceTier;
import com.routecast.common.model.ForecastEmission;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import com.routecast.common.model.RouteObservation;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.model.TierAssessment;
import com.routecast.common.provider.ForecastAttempt;
import com.routecast.common.provider.ModelInvoker;
import com.routecast.common.routing.RoutingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.DoubleSummaryStatistics;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces the forecast of each route for one or more weeks ahead and attaches a
 * prediction interval.
 *
 * <p>Model choice per route:
 * <ul>
 *   <li>no routing entry → {@code defaultModelId}, tier NEW_ROUTE</li>
 *   <li>tier LOW → {@link EnsembleFallback} over the route's rolling ranking</li>
 *   <li>otherwise → the assigned model</li>
 * </ul>
 * The base variance comes from {@link ConfidenceClassifier#assess(RoutingEntry)} and
 * is widened per horizon by {@link HorizonVarianceScaler}. A route for which nothing
 * produces a usable value is skipped and reported, never emitted as zero.
 */
public class ForecastEmitter {

    private static final Logger log = LoggerFactory.getLogger(ForecastEmitter.class);

    private final EngineConfig config;
    private final ModelInvoker invoker;
    private final EnsembleFallback ensemble;
    private final ConfidenceClassifier classifier;
    private final HorizonVarianceScaler scaler;

    public ForecastEmitter(EngineConfig config, ModelInvoker invoker, EnsembleFallback ensemble,
                           ConfidenceClassifier classifier, HorizonVarianceScaler scaler) {
        this.config     = config;
        this.invoker    = invoker;
        this.ensemble   = ensemble;
        this.classifier = classifier;
        this.scaler     = scaler;
    }

    /**
     * @param table      published routing table
     * @param ledger     ledger view used to rank ensemble members
     * @param histories  per-route observations, oldest first; a missing route gets an empty history
     * @param target     first forecast period (horizon 1)
     * @param weeksAhead number of consecutive periods to emit, &gt;= 1
     * @param routes     routes to forecast
     */
    public EmissionBatch emit(RoutingTable table, LedgerView ledger, Map<Route, List<RouteObservation>> histories,
                              Period target, int weeksAhead, Collection<Route> routes) {
        if (weeksAhead < 1) {
            throw new IllegalArgumentException("weeksAhead must be >= 1, got " + weeksAhead);
        }
        RollingPerformanceAggregator aggregator = new RollingPerformanceAggregator(ledger);
        List<ForecastEmission> emissions = new ArrayList<>();
        Set<String> skipped = new LinkedHashSet<>();
        int ensembleCount = 0;

        for (Route route : new LinkedHashSet<>(routes)) {
            RoutingEntry entry = table.get(route).orElse(null);
            TierAssessment base = classifier.assess(entry);
            List<RouteObservation> history = histories.getOrDefault(route, List.of());

            for (int h = 1; h <= weeksAhead; h++) {
                Period period = target.plusWeeks(h - 1);
                PointForecast point = pointForecast(route, entry, aggregator, history, period);
                if (point == null) {
                    log.warn("FORECAST_UNAVAILABLE route={} period={} - route skipped", route, period);
                    skipped.add(route.routeKey());
                    continue;
                }
                if (ModelInvoker.isEnsembleId(point.modelId())) {
                    ensembleCount++;
                }
                double variancePct = scaler.scale(base.variancePct(), h);
                VarianceInterval interval = VarianceInterval.around(point.value(), variancePct);
                emissions.add(new ForecastEmission(route.routeKey(), period, h, point.value(),
                                                   interval.low(), interval.high(), variancePct,
                                                   interval.variancePieces(), point.modelId(), base.tier()));
            }
        }

        log.info("Forecasts emitted. target={} weeksAhead={} emissions={} skippedRoutes={} ensembles={}",
                 target, weeksAhead, emissions.size(), skipped.size(), ensembleCount);
        return new EmissionBatch(List.copyOf(emissions), List.copyOf(skipped), ensembleCount, summarize(emissions));
    }

    private PointForecast pointForecast(Route route, RoutingEntry entry, RollingPerformanceAggregator aggregator,
                                        List<RouteObservation> history, Period period) {
        if (entry == null) {
            return single(config.defaultModelId(), route, history, period);
        }
        if (entry.confidenceTier() == ConfidenceTier.LOW) {
            EnsembleResult blended = ensemble.blend(route, aggregator.rank(route, config.lookbackPeriods()),
                                                    entry.assignedModelId(), history, period);
            return blended.isPresent() ? new PointForecast(blended.modelId(), blended.forecast()) : null;
        }
        return single(entry.assignedModelId(), route, history, period);
    }

    private PointForecast single(String modelId, Route route, List<RouteObservation> history, Period period) {
        ForecastAttempt attempt = invoker.invoke(modelId, route, history, period);
        return attempt.hasUsableValue() ? new PointForecast(modelId, attempt.clampedValue()) : null;
    }

    private static List<TierVarianceSummary> summarize(List<ForecastEmission> emissions) {
        Map<ConfidenceTier, DoubleSummaryStatistics> stats = new EnumMap<>(ConfidenceTier.class);
        for (ForecastEmission e : emissions) {
            stats.computeIfAbsent(e.confidenceTier(), t -> new DoubleSummaryStatistics()).accept(e.variancePct());
        }
        List<TierVarianceSummary> summary = new ArrayList<>();
        stats.forEach((tier, s) -> summary.add(
            new TierVarianceSummary(tier, (int) s.getCount(), s.getAverage(), s.getMin(), s.getMax())));
        return summary;
    }

    private record PointForecast(String modelId, double value) {}
}
