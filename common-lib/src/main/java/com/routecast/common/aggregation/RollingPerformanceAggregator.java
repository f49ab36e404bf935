package com.routecast.common.aggregation;

import com.routecast.common.ledger.LedgerView;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Period;
import com.routecast.common.model.RollingError;
import com.routecast.common.model.Route;
import com.routecast.common.provider.ModelInvoker;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Rolling mean absolute percentage error per {@code (route, model)}.
 *
 * <h3>Window</h3>
 * The window is the {@code lookback} most recent distinct periods present in the
 * ledger <em>for that route</em>, not wall-clock weeks. A route evaluated every
 * other week still gets {@code lookback} data points instead of an empty window.
 *
 * <h3>Coverage</h3>
 * {@code periodsCovered} counts the window periods in which the model has a record.
 * Callers treat {@code periodsCovered < lookback} as weaker evidence.
 *
 * <p>Stateless apart from the view it reads; safe to share across threads when the
 * view is immutable.
 */
public class RollingPerformanceAggregator {

    private final LedgerView ledger;

    public RollingPerformanceAggregator(LedgerView ledger) {
        this.ledger = ledger;
    }

    /** Most recent {@code lookback} distinct periods of the route, newest first. */
    public List<Period> window(Route route, int lookback) {
        requireLookback(lookback);
        return ledger.recordsFor(route).stream()
            .map(PerformanceRecord::period)
            .distinct()
            .sorted(Comparator.reverseOrder())
            .limit(lookback)
            .collect(Collectors.toList());
    }

    public Optional<Period> latestPeriod(Route route) {
        return ledger.recordsFor(route).stream()
            .map(PerformanceRecord::period)
            .max(Comparator.naturalOrder());
    }

    public RollingError rollingError(Route route, String modelId, int lookback) {
        Set<Period> window = new TreeSet<>(window(route, lookback));
        double sum = 0.0;
        int covered = 0;
        for (PerformanceRecord r : ledger.recordsFor(route)) {
            if (r.modelId().equals(modelId) && window.contains(r.period())) {
                sum += r.absErrorPct();
                covered++;
            }
        }
        return covered == 0 ? RollingError.none(modelId) : new RollingError(modelId, sum / covered, covered);
    }

    /**
     * Every model with at least one record in the route's window, best first
     * (lowest mean error, ties by smallest model id). Ensemble records are tracked
     * in the ledger but never ranked: {@code ENSEMBLE_n} is not a model that can be
     * assigned or invoked.
     */
    public List<RollingError> rank(Route route, int lookback) {
        Set<Period> window = new TreeSet<>(window(route, lookback));
        Map<String, double[]> acc = new TreeMap<>();
        for (PerformanceRecord r : ledger.recordsFor(route)) {
            if (!window.contains(r.period()) || ModelInvoker.isEnsembleId(r.modelId())) {
                continue;
            }
            double[] sumAndCount = acc.computeIfAbsent(r.modelId(), k -> new double[2]);
            sumAndCount[0] += r.absErrorPct();
            sumAndCount[1] += 1;
        }
        List<RollingError> ranking = new ArrayList<>(acc.size());
        acc.forEach((model, sc) -> ranking.add(new RollingError(model, sc[0] / sc[1], (int) sc[1])));
        ranking.sort(RollingError.BEST_FIRST);
        return ranking;
    }

    private static void requireLookback(int lookback) {
        if (lookback < 1) {
            throw new IllegalArgumentException("lookback must be >= 1, got " + lookback);
        }
    }
}
