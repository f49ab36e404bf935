package com.routecast.common.analytics;

import com.routecast.common.config.EngineConfig;
import com.routecast.common.ledger.LedgerBatch;
import com.routecast.common.ledger.LedgerView;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Period;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.routing.RoutingTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Reporting aggregates over ledger contents and routing tables. Stateless.
 */
public final class PerformanceAnalytics {

    private PerformanceAnalytics() {}

    public static PeriodSummary summarizePeriod(LedgerBatch batch, EngineConfig config) {
        Map<String, Double> bestPerRoute = new TreeMap<>();
        Map<String, List<Double>> errorsPerModel = new TreeMap<>();
        for (PerformanceRecord r : batch.records()) {
            bestPerRoute.merge(r.route().routeKey(), r.absErrorPct(), Math::min);
            errorsPerModel.computeIfAbsent(r.modelId(), k -> new ArrayList<>()).add(r.absErrorPct());
        }

        List<Double> best = new ArrayList<>(bestPerRoute.values());
        int underHigh = (int) best.stream().filter(e -> e < config.highCutoffPct()).count();
        int underMedium = (int) best.stream().filter(e -> e < config.mediumCutoffPct()).count();

        Comparator<Map.Entry<String, Double>> byMean =
            Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey());
        List<Map.Entry<String, Double>> modelMeans = errorsPerModel.entrySet().stream()
            .map(e -> Map.entry(e.getKey(), mean(e.getValue())))
            .sorted(byMean)
            .collect(Collectors.toList());

        String bestModel  = modelMeans.isEmpty() ? null : modelMeans.get(0).getKey();
        String worstModel = modelMeans.isEmpty() ? null : modelMeans.get(modelMeans.size() - 1).getKey();

        return new PeriodSummary(batch.period(), batch.routesReceived(), bestPerRoute.size(),
                                 mean(best), median(best), underHigh, underMedium, bestModel, worstModel);
    }

    /**
     * Per-model accuracy over the {@code lookback} most recent distinct periods of the
     * whole ledger, ordered by mean error then model id.
     */
    public static List<ModelPerformanceSummary> summarizeModels(LedgerView ledger, int lookback) {
        if (lookback < 1) {
            throw new IllegalArgumentException("lookback must be >= 1, got " + lookback);
        }
        Collection<PerformanceRecord> records = ledger.allRecords();
        Set<Period> window = records.stream()
            .map(PerformanceRecord::period)
            .collect(Collectors.toCollection(TreeSet::new))
            .descendingSet().stream()
            .limit(lookback)
            .collect(Collectors.toSet());

        Map<String, List<PerformanceRecord>> byModel = records.stream()
            .filter(r -> window.contains(r.period()))
            .collect(Collectors.groupingBy(PerformanceRecord::modelId, TreeMap::new, Collectors.toList()));

        List<ModelPerformanceSummary> summaries = new ArrayList<>();
        byModel.forEach((model, rs) -> {
            List<Double> errors = rs.stream().map(PerformanceRecord::absErrorPct).collect(Collectors.toList());
            int routes = (int) rs.stream().map(r -> r.route().routeKey()).distinct().count();
            summaries.add(new ModelPerformanceSummary(model, routes, mean(errors), median(errors),
                errors.stream().mapToDouble(Double::doubleValue).min().orElse(Double.NaN),
                errors.stream().mapToDouble(Double::doubleValue).max().orElse(Double.NaN)));
        });
        summaries.sort(Comparator.comparingDouble(ModelPerformanceSummary::meanError)
                                 .thenComparing(ModelPerformanceSummary::modelId));
        return summaries;
    }

    public static ModelLeaderboard leaderboard(RoutingTable table, Set<String> ledgerModelIds) {
        Map<String, Integer> counts = new TreeMap<>();
        for (RoutingEntry e : table.entries()) {
            counts.merge(e.assignedModelId(), 1, Integer::sum);
        }
        Map<String, Integer> ordered = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                             .thenComparing(Map.Entry.comparingByKey()))
            .forEach(e -> ordered.put(e.getKey(), e.getValue()));

        List<String> zeroWins = new TreeSet<>(ledgerModelIds).stream()
            .filter(m -> !counts.containsKey(m))
            .collect(Collectors.toList());
        return new ModelLeaderboard(table.version(), ordered, zeroWins);
    }

    static double mean(List<Double> values) {
        return values.isEmpty() ? Double.NaN
                                : values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    static double median(List<Double> values) {
        if (values.isEmpty()) {
            return Double.NaN;
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
