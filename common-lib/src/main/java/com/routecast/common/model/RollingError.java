package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * Mean absolute percentage error of one model on one route over a rolling window.
 *
 * <p>{@code periodsCovered == 0} means the model has no evidence in the window;
 * {@code meanAbsErrorPct} is then {@link Double#NaN}.
 */
public record RollingError(
    @JsonProperty("modelId")         String modelId,
    @JsonProperty("meanAbsErrorPct") double meanAbsErrorPct,
    @JsonProperty("periodsCovered")  int    periodsCovered
) {

    /** Lowest error first; ties broken by lexicographically smallest model id. */
    public static final Comparator<RollingError> BEST_FIRST =
        Comparator.comparingDouble(RollingError::meanAbsErrorPct)
                  .thenComparing(RollingError::modelId);

    public static RollingError none(String modelId) {
        return new RollingError(modelId, Double.NaN, 0);
    }

    public boolean hasEvidence() {
        return periodsCovered > 0;
    }

    public boolean covers(int minPeriods) {
        return periodsCovered >= minPeriods;
    }
}
