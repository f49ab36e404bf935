package com.routecast.common.confidence;

/**
 * Prediction interval around a point forecast:
 * {@code [max(0, f − f·v/100), f + f·v/100]}.
 */
public record VarianceInterval(double low, double high, double variancePieces) {

    public static VarianceInterval around(double forecast, double variancePct) {
        double pieces = Math.abs(forecast * variancePct / 100.0);
        return new VarianceInterval(Math.max(0.0, forecast - pieces), forecast + pieces, pieces);
    }
}
