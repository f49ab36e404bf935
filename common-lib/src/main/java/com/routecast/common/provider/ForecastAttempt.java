package com.routecast.common.provider;

/**
 * Result of invoking one model for one route.
 *
 * <ul>
 *   <li>{@code OK}            - finite, non-negative value</li>
 *   <li>{@code NEGATIVE}      - finite but negative; {@code value} holds the raw number</li>
 *   <li>{@code INVALID}       - NaN or infinite</li>
 *   <li>{@code FAILED}        - the model threw</li>
 *   <li>{@code UNKNOWN_MODEL} - no model registered under the id</li>
 * </ul>
 */
public record ForecastAttempt(String modelId, Status status, double value, String failureReason) {

    public enum Status { OK, NEGATIVE, INVALID, FAILED, UNKNOWN_MODEL }

    public boolean isValid() {
        return status == Status.OK;
    }

    /**
     * Value usable by a single-model emission: OK as is, NEGATIVE clamped to zero.
     *
     * @return {@code NaN} when no forecast is available
     */
    public double clampedValue() {
        return switch (status) {
            case OK       -> value;
            case NEGATIVE -> 0.0;
            default       -> Double.NaN;
        };
    }

    public boolean hasUsableValue() {
        return status == Status.OK || status == Status.NEGATIVE;
    }
}
