package com.routecast.common.ledger;

import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Route;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable point-in-time ledger contents. Routing updates read one snapshot for
 * the whole cycle.
 */
public final class LedgerSnapshot implements LedgerView {

    private static final LedgerSnapshot EMPTY = new LedgerSnapshot(Map.of());

    private final Map<Route, List<PerformanceRecord>> byRoute;

    private LedgerSnapshot(Map<Route, List<PerformanceRecord>> byRoute) {
        this.byRoute = byRoute;
    }

    public static LedgerSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from raw records. When two records share a key the later
     * one in iteration order wins, mirroring upsert semantics.
     */
    public static LedgerSnapshot of(Collection<PerformanceRecord> records) {
        Map<PerformanceRecord.Key, PerformanceRecord> unique = new LinkedHashMap<>();
        for (PerformanceRecord r : records) {
            unique.put(r.key(), r);
        }
        Map<Route, List<PerformanceRecord>> grouped = new TreeMap<>();
        for (PerformanceRecord r : unique.values()) {
            grouped.computeIfAbsent(r.route(), k -> new ArrayList<>()).add(r);
        }
        grouped.replaceAll((route, list) -> List.copyOf(list));
        return new LedgerSnapshot(Collections.unmodifiableMap(grouped));
    }

    @Override
    public Set<Route> routes() {
        return byRoute.keySet();
    }

    @Override
    public List<PerformanceRecord> recordsFor(Route route) {
        return byRoute.getOrDefault(route, List.of());
    }

    public int size() {
        return byRoute.values().stream().mapToInt(List::size).sum();
    }
}
