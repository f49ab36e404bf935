package com.routecast.common.routing;

import com.routecast.common.model.CycleReport;
import com.routecast.common.model.RoutingUpdateEvent;

import java.util.List;

/**
 * Output of one routing update: the next table version (not yet published), the
 * audit events of the switches it contains and the cycle counters.
 */
public record RoutingCycleResult(
    RoutingTable             table,
    List<RoutingUpdateEvent> events,
    CycleReport              report
) {}
