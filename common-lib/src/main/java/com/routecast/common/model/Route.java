package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identity of one forecastable time series: shipments from {@code origin} to
 * {@code destination} for one product type on one weekday.
 *
 * <p>The canonical key is {@code origin|destination|productType|dayOfWeek}; it is
 * used as the persisted {@code route_key} and as the deterministic sort order.
 */
public record Route(
    @JsonProperty("origin")      String origin,
    @JsonProperty("destination") String destination,
    @JsonProperty("productType") String productType,
    @JsonProperty("dayOfWeek")   int    dayOfWeek
) implements Comparable<Route> {

    public static final String KEY_SEPARATOR = "|";

    public Route {
        requireSegment(origin, "origin");
        requireSegment(destination, "destination");
        requireSegment(productType, "productType");
        if (dayOfWeek < 0 || dayOfWeek > 7) {
            throw new IllegalArgumentException("dayOfWeek must be within [0, 7], got " + dayOfWeek);
        }
    }

    /** Canonical {@code route_key}. */
    public String routeKey() {
        return origin + KEY_SEPARATOR + destination + KEY_SEPARATOR + productType + KEY_SEPARATOR + dayOfWeek;
    }

    /**
     * Parses a canonical key produced by {@link #routeKey()}.
     *
     * @throws IllegalArgumentException when the key does not have four segments
     *                                  or the weekday is not numeric
     */
    public static Route fromKey(String routeKey) {
        Objects.requireNonNull(routeKey, "routeKey");
        String[] parts = routeKey.split("\\|", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Malformed route key: " + routeKey);
        }
        try {
            return new Route(parts[0], parts[1], parts[2], Integer.parseInt(parts[3]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed day of week in route key: " + routeKey, e);
        }
    }

    @Override
    public int compareTo(Route other) {
        return routeKey().compareTo(other.routeKey());
    }

    @Override
    public String toString() {
        return routeKey();
    }

    private static void requireSegment(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (value.contains(KEY_SEPARATOR)) {
            throw new IllegalArgumentException(name + " must not contain '" + KEY_SEPARATOR + "': " + value);
        }
    }
}
