package com.routecast.common.ledger;

import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Route;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only view of ledger contents, the input of aggregation and routing updates.
 */
public interface LedgerView {

    Set<Route> routes();

    /** All records of a route, in no particular order; empty when the route is unknown. */
    List<PerformanceRecord> recordsFor(Route route);

    default Collection<PerformanceRecord> allRecords() {
        return routes().stream()
            .flatMap(r -> recordsFor(r).stream())
            .collect(Collectors.toList());
    }

    default Set<String> modelIds() {
        return allRecords().stream()
            .map(PerformanceRecord::modelId)
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
