package com.routecast.performance.provider;

import com.routecast.common.model.Period;
import com.routecast.common.model.RouteObservation;
import com.routecast.common.provider.ForecastModel;
import com.routecast.common.provider.ModelRegistry;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Statistical forecasting methods registered at startup.
 *
 * <p>Every method receives the route's observations oldest first and returns a
 * weekly quantity &gt;= 0. A method that lacks the history it needs throws
 * {@link IllegalStateException}; the engine records that as "no forecast" for the
 * route instead of substituting zero.
 *
 * <pre>
 *   HISTORICAL_BASELINE       mean of the target week in earlier years, else mean of all history
 *   RECENT_2W_AVG             mean of the last 2 observations
 *   RECENT_4W_AVG             mean of the last 4 observations
 *   RECENT_8W_AVG             mean of the last 8 observations
 *   TREND_ADJUSTED            recent-4 mean × clamp(recent-4 / prior-4, 0.5, 1.5)
 *   PRIOR_WEEK                the latest observation
 *   SAME_WEEK_LAST_YEAR       the target week one year earlier
 *   WEEK_SPECIFIC_HISTORICAL  mean of the target week across years, needs 2 years
 *   EXPONENTIAL_SMOOTHING     simple exponential smoothing, α = 0.3
 *   MEDIAN_RECENT_4W          median of the last 4 observations
 *   HYBRID_WEEK_BLEND         0.7 × week-specific + 0.3 × recent-4 mean
 * </pre>
 */
public final class BuiltinForecastModels {

    public static final String HISTORICAL_BASELINE      = "HISTORICAL_BASELINE";
    public static final String RECENT_2W_AVG            = "RECENT_2W_AVG";
    public static final String RECENT_4W_AVG            = "RECENT_4W_AVG";
    public static final String RECENT_8W_AVG            = "RECENT_8W_AVG";
    public static final String TREND_ADJUSTED           = "TREND_ADJUSTED";
    public static final String PRIOR_WEEK               = "PRIOR_WEEK";
    public static final String SAME_WEEK_LAST_YEAR      = "SAME_WEEK_LAST_YEAR";
    public static final String WEEK_SPECIFIC_HISTORICAL = "WEEK_SPECIFIC_HISTORICAL";
    public static final String EXPONENTIAL_SMOOTHING    = "EXPONENTIAL_SMOOTHING";
    public static final String MEDIAN_RECENT_4W         = "MEDIAN_RECENT_4W";
    public static final String HYBRID_WEEK_BLEND        = "HYBRID_WEEK_BLEND";

    static final double SMOOTHING_ALPHA = 0.3;
    static final double MIN_TREND = 0.5;
    static final double MAX_TREND = 1.5;

    private BuiltinForecastModels() {}

    public static ModelRegistry.Builder registerAll(ModelRegistry.Builder builder) {
        return builder
            .register(HISTORICAL_BASELINE,      BuiltinForecastModels::historicalBaseline)
            .register(RECENT_2W_AVG,            recentMean(2))
            .register(RECENT_4W_AVG,            recentMean(4))
            .register(RECENT_8W_AVG,            recentMean(8))
            .register(TREND_ADJUSTED,           BuiltinForecastModels::trendAdjusted)
            .register(PRIOR_WEEK,               BuiltinForecastModels::priorWeek)
            .register(SAME_WEEK_LAST_YEAR,      BuiltinForecastModels::sameWeekLastYear)
            .register(WEEK_SPECIFIC_HISTORICAL, BuiltinForecastModels::weekSpecific)
            .register(EXPONENTIAL_SMOOTHING,    BuiltinForecastModels::exponentialSmoothing)
            .register(MEDIAN_RECENT_4W,         BuiltinForecastModels::medianRecent4)
            .register(HYBRID_WEEK_BLEND,        BuiltinForecastModels::hybridWeekBlend);
    }

    // ── methods ──────────────────────────────────────────────────────────────

    static double historicalBaseline(List<RouteObservation> history, Period target, String productType) {
        double[] sameWeek = quantities(history, o -> o.period().week() == target.week()
                                                     && o.period().year() < target.year());
        if (sameWeek.length > 0) {
            return mean(sameWeek);
        }
        return mean(require(quantities(history, o -> true), 1, HISTORICAL_BASELINE));
    }

    static ForecastModel recentMean(int weeks) {
        return (history, target, productType) -> mean(require(last(history, weeks), weeks, "RECENT_" + weeks + "W_AVG"));
    }

    static double trendAdjusted(List<RouteObservation> history, Period target, String productType) {
        double[] recent = require(last(history, 4), 4, TREND_ADJUSTED);
        double recentMean = mean(recent);
        if (history.size() < 8) {
            return recentMean;
        }
        double olderMean = mean(Arrays.copyOfRange(last(history, 8), 0, 4));
        if (olderMean <= 0.0) {
            return recentMean;
        }
        double trend = Math.max(MIN_TREND, Math.min(MAX_TREND, recentMean / olderMean));
        return recentMean * trend;
    }

    static double priorWeek(List<RouteObservation> history, Period target, String productType) {
        return require(last(history, 1), 1, PRIOR_WEEK)[0];
    }

    static double sameWeekLastYear(List<RouteObservation> history, Period target, String productType) {
        double[] values = quantities(history, o -> o.period().week() == target.week()
                                                   && o.period().year() == target.year() - 1);
        return mean(require(values, 1, SAME_WEEK_LAST_YEAR));
    }

    static double weekSpecific(List<RouteObservation> history, Period target, String productType) {
        double[] values = quantities(history, o -> o.period().week() == target.week()
                                                   && o.period().year() < target.year());
        return mean(require(values, 2, WEEK_SPECIFIC_HISTORICAL));
    }

    static double exponentialSmoothing(List<RouteObservation> history, Period target, String productType) {
        double[] values = require(quantities(history, o -> true), 1, EXPONENTIAL_SMOOTHING);
        double level = values[0];
        for (int i = 1; i < values.length; i++) {
            level = SMOOTHING_ALPHA * values[i] + (1.0 - SMOOTHING_ALPHA) * level;
        }
        return level;
    }

    static double medianRecent4(List<RouteObservation> history, Period target, String productType) {
        double[] sorted = require(last(history, 4), 4, MEDIAN_RECENT_4W).clone();
        Arrays.sort(sorted);
        return (sorted[1] + sorted[2]) / 2.0;
    }

    static double hybridWeekBlend(List<RouteObservation> history, Period target, String productType) {
        return 0.7 * weekSpecific(history, target, productType)
             + 0.3 * recentMean(4).forecast(history, target, productType);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static double[] last(List<RouteObservation> history, int n) {
        int from = Math.max(0, history.size() - n);
        return history.subList(from, history.size()).stream()
            .mapToDouble(RouteObservation::quantity)
            .toArray();
    }

    private static double[] quantities(List<RouteObservation> history, Predicate<RouteObservation> filter) {
        return history.stream().filter(filter).mapToDouble(RouteObservation::quantity).toArray();
    }

    private static double[] require(double[] values, int minimum, String modelId) {
        if (values.length < minimum) {
            throw new IllegalStateException(modelId + " needs " + minimum + " observations, got " + values.length);
        }
        return values;
    }

    private static double mean(double[] values) {
        return Arrays.stream(values).average().orElseThrow();
    }
}
