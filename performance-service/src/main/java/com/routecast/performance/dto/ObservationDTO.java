package com.routecast.performance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One weekly observed quantity of a route, as submitted for history upserts.
 */
public record ObservationDTO(
    @JsonProperty("routeKey") String routeKey,
    @JsonProperty("week")     int    week,
    @JsonProperty("year")     int    year,
    @JsonProperty("quantity") double quantity
) {}
