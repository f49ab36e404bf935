package com.routecast.performance.config;

import com.routecast.common.config.EngineConfig;
import com.routecast.common.provider.ModelRegistry;
import com.routecast.performance.provider.BuiltinForecastModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ForecastModelConfig {

    private static final Logger log = LoggerFactory.getLogger(ForecastModelConfig.class);

    @Bean
    public ModelRegistry modelRegistry(EngineConfig config) {
        ModelRegistry registry = BuiltinForecastModels.registerAll(ModelRegistry.builder()).build();
        if (!registry.contains(config.defaultModelId())) {
            throw new IllegalStateException("default model " + config.defaultModelId()
                                            + " is not registered; known models " + registry.modelIds());
        }
        log.info("Forecast model registry built. models={}", registry.modelIds());
        return registry;
    }
}
