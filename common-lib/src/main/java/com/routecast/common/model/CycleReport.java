package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome counters of one routing update cycle.
 *
 * <ul>
 *   <li>{@code switched}                    - entries reassigned to a better model</li>
 *   <li>{@code refreshed}                   - entries kept, error and tier refreshed</li>
 *   <li>{@code created}                     - routes admitted from NEW_ROUTE</li>
 *   <li>{@code skippedInsufficientEvidence} - current model below the evidence minimum</li>
 *   <li>{@code unchangedNoData}             - no model has data in the window</li>
 *   <li>{@code failed}                      - route evaluation raised and was isolated</li>
 * </ul>
 */
public record CycleReport(
    @JsonProperty("tableVersion")                long tableVersion,
    @JsonProperty("routesEvaluated")             int  routesEvaluated,
    @JsonProperty("switched")                    int  switched,
    @JsonProperty("refreshed")                   int  refreshed,
    @JsonProperty("created")                     int  created,
    @JsonProperty("skippedInsufficientEvidence") int  skippedInsufficientEvidence,
    @JsonProperty("unchangedNoData")             int  unchangedNoData,
    @JsonProperty("failed")                      int  failed
) {}
