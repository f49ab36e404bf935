package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the confidence classifier: a tier and its single-period variance in percent.
 */
public record TierAssessment(
    @JsonProperty("tier")        ConfidenceTier tier,
    @JsonProperty("variancePct") double         variancePct
) {}
