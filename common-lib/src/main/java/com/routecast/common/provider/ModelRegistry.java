package com.routecast.common.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable model-id → {@link ForecastModel} lookup, built once at startup.
 */
public final class ModelRegistry {

    private final Map<String, ForecastModel> models;

    private ModelRegistry(Map<String, ForecastModel> models) {
        this.models = Collections.unmodifiableMap(models);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ForecastModel> find(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public boolean contains(String modelId) {
        return models.containsKey(modelId);
    }

    /** Registered ids in registration order. */
    public Set<String> modelIds() {
        return models.keySet();
    }

    public int size() {
        return models.size();
    }

    public static final class Builder {
        private final Map<String, ForecastModel> models = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String modelId, ForecastModel model) {
            if (modelId == null || modelId.isBlank()) {
                throw new IllegalArgumentException("modelId must not be blank");
            }
            if (modelId.startsWith(ModelInvoker.ENSEMBLE_PREFIX)) {
                throw new IllegalArgumentException("modelId prefix " + ModelInvoker.ENSEMBLE_PREFIX + " is reserved");
            }
            if (models.putIfAbsent(modelId, model) != null) {
                throw new IllegalArgumentException("duplicate model id " + modelId);
            }
            return this;
        }

        public ModelRegistry build() {
            return new ModelRegistry(new LinkedHashMap<>(models));
        }
    }
}
