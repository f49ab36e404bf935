package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit record written only when a routing update actually switches a route's model.
 */
public record RoutingUpdateEvent(
    @JsonProperty("route")            Route   route,
    @JsonProperty("period")           Period  period,
    @JsonProperty("oldModel")         String  oldModel,
    @JsonProperty("newModel")         String  newModel,
    @JsonProperty("errorImprovement") double  errorImprovement,
    @JsonProperty("reason")           String  reason,
    @JsonProperty("timestamp")        Instant timestamp
) {}
