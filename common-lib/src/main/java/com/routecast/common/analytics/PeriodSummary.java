package com.routecast.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.routecast.common.model.Period;

/**
 * Aggregate accuracy of one evaluation period. Per route, the best (lowest)
 * absolute error across models is used; {@code bestModel}/{@code worstModel} rank
 * models by mean absolute error over the period's routes.
 */
public record PeriodSummary(
    @JsonProperty("period")            Period period,
    @JsonProperty("totalRoutes")       int    totalRoutes,
    @JsonProperty("routesWithActuals") int    routesWithActuals,
    @JsonProperty("averageMape")       double averageMape,
    @JsonProperty("medianMape")        double medianMape,
    @JsonProperty("routesUnderHigh")   int    routesUnderHigh,
    @JsonProperty("routesUnderMedium") int    routesUnderMedium,
    @JsonProperty("bestModel")         String bestModel,
    @JsonProperty("worstModel")        String worstModel
) {}
