package com.routecast.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Accuracy of one model across all routes within the ledger-wide lookback window.
 */
public record ModelPerformanceSummary(
    @JsonProperty("modelId")      String modelId,
    @JsonProperty("routes")       int    routes,
    @JsonProperty("meanError")    double meanError,
    @JsonProperty("medianError")  double medianError,
    @JsonProperty("minError")     double minError,
    @JsonProperty("maxError")     double maxError
) {}
