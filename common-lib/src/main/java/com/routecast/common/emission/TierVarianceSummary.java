package com.routecast.common.emission;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.routecast.common.model.ConfidenceTier;

/**
 * Variance statistics of the emissions that fell into one confidence tier.
 */
public record TierVarianceSummary(
    @JsonProperty("tier")            ConfidenceTier tier,
    @JsonProperty("emissions")       int            emissions,
    @JsonProperty("meanVariancePct") double         meanVariancePct,
    @JsonProperty("minVariancePct")  double         minVariancePct,
    @JsonProperty("maxVariancePct")  double         maxVariancePct
) {}
