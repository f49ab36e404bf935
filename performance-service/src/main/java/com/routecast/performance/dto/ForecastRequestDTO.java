package com.routecast.performance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Forecast emission request.
 *
 * @param weeksAhead number of consecutive periods from the target; {@code null} means 1
 * @param routeKeys  routes to forecast; empty or {@code null} means every known route
 */
public record ForecastRequestDTO(
    @JsonProperty("week")       int          week,
    @JsonProperty("year")       int          year,
    @JsonProperty("weeksAhead") Integer      weeksAhead,
    @JsonProperty("routeKeys")  List<String> routeKeys
) {}
