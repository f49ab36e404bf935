package com.routecast.performance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiErrorDTO(
    @JsonProperty("status")  int    status,
    @JsonProperty("error")   String error,
    @JsonProperty("message") String message
) {}
