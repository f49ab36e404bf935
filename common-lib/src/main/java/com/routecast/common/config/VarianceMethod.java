package com.routecast.common.config;

/**
 * How the single-period variance of an emitted forecast is derived.
 *
 * <ul>
 *   <li>{@code CONFIDENCE} - from the route's confidence tier (tier table)</li>
 *   <li>{@code HISTORICAL} - from the absolute historical error; falls back to the
 *       tier table when the route has no known error</li>
 * </ul>
 */
public enum VarianceMethod {
    CONFIDENCE,
    HISTORICAL
}
