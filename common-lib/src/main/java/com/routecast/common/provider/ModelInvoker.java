package com.routecast.common.provider;

import com.routecast.common.exception.ModelProviderException;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import com.routecast.common.model.RouteObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Calls registered models with per-route, per-model failure isolation. A model that
 * throws or returns an unusable value yields a non-OK {@link ForecastAttempt}; no
 * exception escapes.
 */
public class ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(ModelInvoker.class);

    /** Prefix of synthetic ensemble model ids, e.g. {@code ENSEMBLE_3}. */
    public static final String ENSEMBLE_PREFIX = "ENSEMBLE_";

    private final ModelRegistry registry;

    public ModelInvoker(ModelRegistry registry) {
        this.registry = registry;
    }

    public ForecastAttempt invoke(String modelId, Route route, List<RouteObservation> history, Period target) {
        ForecastModel model = registry.find(modelId).orElse(null);
        if (model == null) {
            log.warn("MODEL_PROVIDER_FAILURE route={} model={} reason=unknown model id", route, modelId);
            return new ForecastAttempt(modelId, ForecastAttempt.Status.UNKNOWN_MODEL, Double.NaN, "unknown model id");
        }
        double value;
        try {
            value = model.forecast(history, target, route.productType());
        } catch (RuntimeException e) {
            ModelProviderException failure =
                new ModelProviderException(route.routeKey(), modelId, "forecast raised", e);
            log.warn("MODEL_PROVIDER_FAILURE route={} model={} reason={}", route, modelId, e.toString());
            return new ForecastAttempt(modelId, ForecastAttempt.Status.FAILED, Double.NaN, failure.getMessage());
        }
        if (!Double.isFinite(value)) {
            log.warn("MODEL_PROVIDER_FAILURE route={} model={} reason=non-finite value {}", route, modelId, value);
            return new ForecastAttempt(modelId, ForecastAttempt.Status.INVALID, value, "non-finite value");
        }
        if (value < 0.0) {
            log.warn("MODEL_PROVIDER_FAILURE route={} model={} reason=negative value {}", route, modelId, value);
            return new ForecastAttempt(modelId, ForecastAttempt.Status.NEGATIVE, value, "negative value");
        }
        return new ForecastAttempt(modelId, ForecastAttempt.Status.OK, value, null);
    }

    public static String ensembleId(int contributors) {
        return ENSEMBLE_PREFIX + contributors;
    }

    /** True for the synthetic {@code ENSEMBLE_n} ids, which no registered model can carry. */
    public static boolean isEnsembleId(String modelId) {
        return modelId != null && modelId.startsWith(ENSEMBLE_PREFIX);
    }
}
