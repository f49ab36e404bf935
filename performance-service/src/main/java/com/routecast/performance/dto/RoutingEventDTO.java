package com.routecast.performance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record RoutingEventDTO(
    @JsonProperty("routeKey")         String        routeKey,
    @JsonProperty("week")             int           week,
    @JsonProperty("year")             int           year,
    @JsonProperty("oldModel")         String        oldModel,
    @JsonProperty("newModel")         String        newModel,
    @JsonProperty("errorImprovement") double        errorImprovement,
    @JsonProperty("reason")           String        reason,
    @JsonProperty("tableVersion")     long          tableVersion,
    @JsonProperty("timestamp")        LocalDateTime timestamp
) {}
