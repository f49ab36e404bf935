package com.routecast.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Route assignments per model in a routing table.
 *
 * @param routesByModel   model id → number of routes assigned to it, most routes first
 * @param zeroWinModels   models present in the ledger that no route is assigned to
 */
public record ModelLeaderboard(
    @JsonProperty("tableVersion")  long                 tableVersion,
    @JsonProperty("routesByModel") Map<String, Integer> routesByModel,
    @JsonProperty("zeroWinModels") List<String>         zeroWinModels
) {}
