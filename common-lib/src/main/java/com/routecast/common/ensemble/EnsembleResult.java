package com.routecast.common.ensemble;

import java.util.List;

/**
 * Blended forecast of a LOW-confidence route.
 *
 * @param modelId      {@code ENSEMBLE_n} when n models contributed, the assigned model id
 *                     when every ensemble member failed and the assigned model answered,
 *                     {@code null} when nothing produced a forecast
 * @param contributors model ids whose values were averaged
 * @param fellBack     true when the assigned model was used as last resort
 */
public record EnsembleResult(String modelId, double forecast, List<String> contributors, boolean fellBack) {

    public static EnsembleResult failed() {
        return new EnsembleResult(null, Double.NaN, List.of(), true);
    }

    public boolean isPresent() {
        return modelId != null;
    }
}
