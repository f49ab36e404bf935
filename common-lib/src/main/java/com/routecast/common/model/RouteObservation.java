package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One historical shipment quantity of a route, as supplied by the historical store.
 */
public record RouteObservation(
    @JsonProperty("period")   Period period,
    @JsonProperty("quantity") double quantity
) {}
