package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current best-model assignment for one route.
 *
 * <p>{@code lastUpdatedPeriod} is the most recent ledger period that contributed
 * evidence to this entry; it may be {@code null} for entries seeded from a backtest.
 */
public record RoutingEntry(
    @JsonProperty("route")              Route          route,
    @JsonProperty("assignedModelId")    String         assignedModelId,
    @JsonProperty("historicalErrorPct") double         historicalErrorPct,
    @JsonProperty("confidenceTier")     ConfidenceTier confidenceTier,
    @JsonProperty("lastUpdatedPeriod")  Period         lastUpdatedPeriod
) {

    public RoutingEntry {
        if (route == null) {
            throw new IllegalArgumentException("route must not be null");
        }
        if (assignedModelId == null || assignedModelId.isBlank()) {
            throw new IllegalArgumentException("assignedModelId must not be blank for route " + route);
        }
        if (confidenceTier == null || confidenceTier == ConfidenceTier.NEW_ROUTE) {
            throw new IllegalArgumentException("routing entries carry HIGH, MEDIUM or LOW, got " + confidenceTier);
        }
    }
}
