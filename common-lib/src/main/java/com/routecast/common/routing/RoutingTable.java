package com.routecast.common.routing;

import com.routecast.common.model.ConfidenceTier;
import com.routecast.common.model.Route;
import com.routecast.common.model.RoutingEntry;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, versioned best-model assignment per route.
 *
 * <p>An update cycle never mutates a published table; it builds version
 * {@code v + 1} and republishes it as a whole, so a failed cycle leaves the
 * previous table intact.
 */
public final class RoutingTable {

    private static final RoutingTable EMPTY = new RoutingTable(0L, Map.of());

    private final long version;
    private final Map<Route, RoutingEntry> entries;

    private RoutingTable(long version, Map<Route, RoutingEntry> entries) {
        this.version = version;
        this.entries = entries;
    }

    public static RoutingTable empty() {
        return EMPTY;
    }

    public static RoutingTable of(long version, Collection<RoutingEntry> entries) {
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0, got " + version);
        }
        Map<Route, RoutingEntry> sorted = new TreeMap<>();
        for (RoutingEntry e : entries) {
            if (sorted.put(e.route(), e) != null) {
                throw new IllegalArgumentException("duplicate routing entry for route " + e.route());
            }
        }
        return new RoutingTable(version, Collections.unmodifiableMap(sorted));
    }

    public long version() {
        return version;
    }

    public Optional<RoutingEntry> get(Route route) {
        return Optional.ofNullable(entries.get(route));
    }

    public boolean contains(Route route) {
        return entries.containsKey(route);
    }

    /** Effective tier of a route; {@link ConfidenceTier#NEW_ROUTE} when it has no entry. */
    public ConfidenceTier tierOf(Route route) {
        RoutingEntry entry = entries.get(route);
        return entry == null ? ConfidenceTier.NEW_ROUTE : entry.confidenceTier();
    }

    /** Entries in route-key order. */
    public List<RoutingEntry> entries() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public Map<ConfidenceTier, Integer> tierDistribution() {
        Map<ConfidenceTier, Integer> dist = new EnumMap<>(ConfidenceTier.class);
        entries.values().forEach(e -> dist.merge(e.confidenceTier(), 1, Integer::sum));
        return dist;
    }
}
