package com.routecast.common.emission;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.routecast.common.model.ForecastEmission;

import java.util.List;

/**
 * Every forecast emitted for one request, plus the routes that produced none.
 */
public record EmissionBatch(
    @JsonProperty("emissions")        List<ForecastEmission>    emissions,
    @JsonProperty("skippedRouteKeys") List<String>              skippedRouteKeys,
    @JsonProperty("ensembleCount")    int                       ensembleCount,
    @JsonProperty("tierSummary")      List<TierVarianceSummary> tierSummary
) {}
