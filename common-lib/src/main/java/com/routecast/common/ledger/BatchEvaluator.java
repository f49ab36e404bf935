package com.routecast.common.ledger;

import com.routecast.common.config.EngineConfig;
import com.routecast.common.model.EvaluationBatch;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns raw forecast-vs-actual values into {@link PerformanceRecord}s without
 * touching storage.
 *
 * <p>Rules:
 * <ul>
 *   <li>Missing, NaN, infinite or negative actual → the whole route is excluded (MissingActual).</li>
 *   <li>Missing, NaN or infinite forecast → that model is dropped for the route.</li>
 *   <li>Negative forecast → clamped to zero before the error is computed.</li>
 *   <li>Duplicate routes within one batch → last occurrence wins, so a batch is
 *       idempotent under retry.</li>
 * </ul>
 */
public class BatchEvaluator {

    private static final Logger log = LoggerFactory.getLogger(BatchEvaluator.class);

    private final EngineConfig config;
    private final Clock clock;

    public BatchEvaluator(EngineConfig config, Clock clock) {
        this.config = config;
        this.clock  = clock;
    }

    /**
     * Builds one record. Negative forecasts are clamped to zero.
     *
     * @throws IllegalArgumentException for a non-finite forecast, or an actual that is
     *                                  negative or non-finite
     */
    public PerformanceRecord toRecord(Route route, Period period, String modelId,
                                      double forecastValue, double actualValue) {
        if (!Double.isFinite(actualValue) || actualValue < 0.0) {
            throw new IllegalArgumentException("actual must be finite and >= 0 for route "
                                               + route + ", got " + actualValue);
        }
        if (!Double.isFinite(forecastValue)) {
            throw new IllegalArgumentException("forecast must be finite for route " + route
                                               + " model " + modelId + ", got " + forecastValue);
        }
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank for route " + route);
        }
        double forecast = Math.max(0.0, forecastValue);
        double penalty  = config.zeroActualPenaltyPct();
        double errorPct = ForecastErrorCalculator.errorPct(forecast, actualValue, penalty);
        return new PerformanceRecord(route, period, modelId, forecast, actualValue,
                                     errorPct, Math.abs(errorPct), Instant.now(clock));
    }

    public LedgerBatch evaluate(EvaluationBatch batch) {
        Period period = batch.period();

        // last occurrence of a route wins
        Map<Route, EvaluationBatch.RouteOutcome> outcomes = new TreeMap<>();
        for (EvaluationBatch.RouteOutcome outcome : batch.outcomes()) {
            if (outcome == null || outcome.route() == null) {
                continue;
            }
            outcomes.put(outcome.route(), outcome);
        }

        List<PerformanceRecord> records = new ArrayList<>();
        List<String> missingActual = new ArrayList<>();
        int rejected = 0;

        for (EvaluationBatch.RouteOutcome outcome : outcomes.values()) {
            Route route = outcome.route();
            Double actual = outcome.actualValue();
            if (actual == null || !Double.isFinite(actual) || actual < 0.0) {
                log.warn("MISSING_ACTUAL route={} period={} actual={} - route excluded from ledger write",
                         route, period, actual);
                missingActual.add(route.routeKey());
                continue;
            }
            Map<String, Double> forecasts = outcome.forecasts() == null ? Map.of() : outcome.forecasts();
            for (Map.Entry<String, Double> f : new TreeMap<>(forecasts).entrySet()) {
                Double value = f.getValue();
                if (value == null || !Double.isFinite(value)) {
                    log.warn("INVALID_FORECAST route={} period={} model={} value={} - dropped",
                             route, period, f.getKey(), value);
                    rejected++;
                    continue;
                }
                if (value < 0.0) {
                    log.warn("NEGATIVE_FORECAST route={} period={} model={} value={} - clamped to 0",
                             route, period, f.getKey(), value);
                }
                try {
                    records.add(toRecord(route, period, f.getKey(), value, actual));
                } catch (IllegalArgumentException e) {
                    log.warn("INVALID_FORECAST route={} period={} reason={} - dropped", route, period, e.getMessage());
                    rejected++;
                }
            }
        }

        log.info("Evaluation batch prepared. period={} routes={} records={} missingActual={} rejected={}",
                 period, outcomes.size(), records.size(), missingActual.size(), rejected);
        return new LedgerBatch(period, outcomes.size(), List.copyOf(records), List.copyOf(missingActual), rejected);
    }
}
