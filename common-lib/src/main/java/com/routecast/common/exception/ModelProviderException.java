package com.routecast.common.exception;

/**
 * A forecasting method raised or produced an unusable value for a route.
 * Always isolated to that route and model.
 */
public class ModelProviderException extends RoutingEngineException {
    private final String modelId;

    public ModelProviderException(String routeKey, String modelId, String message) {
        super(routeKey, modelId + ": " + message);
        this.modelId = modelId;
    }

    public ModelProviderException(String routeKey, String modelId, String message, Throwable cause) {
        super(routeKey, modelId + ": " + message, cause);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
