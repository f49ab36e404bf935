package com.routecast.performance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Backtest winner of one route, used to seed an initial routing table.
 */
public record SeedEntryDTO(
    @JsonProperty("routeKey")           String routeKey,
    @JsonProperty("modelId")            String modelId,
    @JsonProperty("historicalErrorPct") double historicalErrorPct
) {}
