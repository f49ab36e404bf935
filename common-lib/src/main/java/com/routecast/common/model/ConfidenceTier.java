package com.routecast.common.model;

/**
 * Discrete trust level attached to a route's assigned model.
 *
 * <p>Declaration order is badness order: {@code HIGH < MEDIUM < LOW < NEW_ROUTE}.
 * {@code NEW_ROUTE} is reserved for routes that have no routing entry yet.
 */
public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW,
    NEW_ROUTE;

    public boolean isWorseThan(ConfidenceTier other) {
        return ordinal() > other.ordinal();
    }
}
