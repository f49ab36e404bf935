package com.routecast.performance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.routecast.common.model.ConfidenceTier;

/**
 * Routing table export row.
 */
public record RoutingTableRowDTO(
    @JsonProperty("routeKey")           String         routeKey,
    @JsonProperty("origin")             String         origin,
    @JsonProperty("destination")        String         destination,
    @JsonProperty("productType")        String         productType,
    @JsonProperty("dayOfWeek")          int            dayOfWeek,
    @JsonProperty("assignedModelId")    String         assignedModelId,
    @JsonProperty("historicalErrorPct") double         historicalErrorPct,
    @JsonProperty("confidenceTier")     ConfidenceTier confidenceTier,
    @JsonProperty("tableVersion")       long           tableVersion
) {}
