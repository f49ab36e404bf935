package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One forecast-vs-actual observation for a {@code (route, period, model)} triple.
 *
 * <p>{@code errorPct} is signed, {@code (forecast - actual) / actual * 100}; the
 * zero-actual convention is applied by
 * {@link com.routecast.common.ledger.ForecastErrorCalculator}.
 */
public record PerformanceRecord(
    @JsonProperty("route")         Route   route,
    @JsonProperty("period")        Period  period,
    @JsonProperty("modelId")       String  modelId,
    @JsonProperty("forecastValue") double  forecastValue,
    @JsonProperty("actualValue")   double  actualValue,
    @JsonProperty("errorPct")      double  errorPct,
    @JsonProperty("absErrorPct")   double  absErrorPct,
    @JsonProperty("recordedAt")    Instant recordedAt
) {

    /** Uniqueness key of the ledger: at most one record per key. */
    public record Key(String routeKey, Period period, String modelId) {}

    public Key key() {
        return new Key(route.routeKey(), period, modelId);
    }
}
