package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome counters of one evaluation-batch ingestion.
 */
public record IngestionReport(
    @JsonProperty("period")                  Period period,
    @JsonProperty("routesReceived")          int    routesReceived,
    @JsonProperty("routesRecorded")          int    routesRecorded,
    @JsonProperty("routesMissingActual")     int    routesMissingActual,
    @JsonProperty("recordsWritten")          int    recordsWritten,
    @JsonProperty("forecastsRejected")       int    forecastsRejected
) {}
