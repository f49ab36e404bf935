package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One evaluation-period result set: per route, the actual outcome and every
 * model's forecast for that period.
 *
 * <p>{@code actualValue} is nullable; a route without an actual is excluded from
 * the ledger write rather than recorded as zero.
 */
public record EvaluationBatch(
    @JsonProperty("period")   Period             period,
    @JsonProperty("outcomes") List<RouteOutcome> outcomes
) {

    public EvaluationBatch {
        if (period == null) {
            throw new IllegalArgumentException("period must not be null");
        }
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public record RouteOutcome(
        @JsonProperty("route")       Route               route,
        @JsonProperty("actualValue") Double              actualValue,
        @JsonProperty("forecasts")   Map<String, Double> forecasts
    ) {}
}
