package com.routecast.performance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ObservationReportDTO(
    @JsonProperty("received") int received,
    @JsonProperty("written")  int written
) {}
