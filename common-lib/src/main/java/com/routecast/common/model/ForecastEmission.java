package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Emitted forecast for one route and one horizon, with its prediction interval.
 *
 * <p>{@code modelId} is either a real model identifier or a synthetic
 * {@code ENSEMBLE_n} composite.
 */
public record ForecastEmission(
    @JsonProperty("routeKey")       String         routeKey,
    @JsonProperty("period")         Period         period,
    @JsonProperty("weeksAhead")     int            weeksAhead,
    @JsonProperty("forecast")       double         forecast,
    @JsonProperty("forecastLow")    double         forecastLow,
    @JsonProperty("forecastHigh")   double         forecastHigh,
    @JsonProperty("variancePct")    double         variancePct,
    @JsonProperty("variancePieces") double         variancePieces,
    @JsonProperty("modelId")        String         modelId,
    @JsonProperty("confidenceTier") ConfidenceTier confidenceTier
) {}
