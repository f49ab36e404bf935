package com.routecast.performance.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.routecast.common.confidence.ConfidenceClassifier;
import com.routecast.common.confidence.HorizonVarianceScaler;
import com.routecast.common.config.EngineConfig;
import com.routecast.common.config.VarianceMethod;
import com.routecast.common.emission.ForecastEmitter;
import com.routecast.common.ensemble.EnsembleFallback;
import com.routecast.common.ledger.BatchEvaluator;
import com.routecast.common.provider.ModelInvoker;
import com.routecast.common.provider.ModelRegistry;
import com.routecast.common.routing.RoutingUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PerformanceServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(PerformanceServiceConfig.class);

    @Value("${routing.engine.lookback-periods:4}")
    private int lookbackPeriods;

    @Value("${routing.engine.min-periods-for-switch:2}")
    private int minPeriodsForSwitch;

    @Value("${routing.engine.switch-threshold-pct:5.0}")
    private double switchThresholdPct;

    @Value("${routing.engine.ensemble-size:3}")
    private int ensembleSize;

    @Value("${routing.engine.high-cutoff-pct:20.0}")
    private double highCutoffPct;

    @Value("${routing.engine.medium-cutoff-pct:50.0}")
    private double mediumCutoffPct;

    @Value("${routing.engine.high-variance-cap-pct:10.0}")
    private double highVarianceCapPct;

    @Value("${routing.engine.medium-variance-pct:25.0}")
    private double mediumVariancePct;

    @Value("${routing.engine.low-variance-pct:50.0}")
    private double lowVariancePct;

    @Value("${routing.engine.new-route-variance-pct:100.0}")
    private double newRouteVariancePct;

    @Value("${routing.engine.zero-actual-penalty-pct:999.0}")
    private double zeroActualPenaltyPct;

    @Value("${routing.engine.horizon-step:0.2}")
    private double horizonStep;

    @Value("${routing.engine.variance-method:CONFIDENCE}")
    private VarianceMethod varianceMethod;

    @Value("${routing.engine.default-model-id:" + EngineConfig.DEFAULT_MODEL_ID + "}")
    private String defaultModelId;

    @Bean
    public EngineConfig engineConfig() {
        EngineConfig config = EngineConfig.builder()
            .lookbackPeriods(lookbackPeriods)
            .minPeriodsForSwitch(minPeriodsForSwitch)
            .switchThresholdPct(switchThresholdPct)
            .ensembleSize(ensembleSize)
            .highCutoffPct(highCutoffPct)
            .mediumCutoffPct(mediumCutoffPct)
            .highVarianceCapPct(highVarianceCapPct)
            .mediumVariancePct(mediumVariancePct)
            .lowVariancePct(lowVariancePct)
            .newRouteVariancePct(newRouteVariancePct)
            .zeroActualPenaltyPct(zeroActualPenaltyPct)
            .horizonStep(horizonStep)
            .varianceMethod(varianceMethod)
            .defaultModelId(defaultModelId)
            .build();
        log.info("Routing engine configured. {}", config);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConfidenceClassifier confidenceClassifier(EngineConfig config) {
        return new ConfidenceClassifier(config);
    }

    @Bean
    public HorizonVarianceScaler horizonVarianceScaler(EngineConfig config) {
        return new HorizonVarianceScaler(config.horizonStep());
    }

    @Bean
    public BatchEvaluator batchEvaluator(EngineConfig config, Clock clock) {
        return new BatchEvaluator(config, clock);
    }

    @Bean
    public RoutingUpdater routingUpdater(EngineConfig config, ConfidenceClassifier classifier, Clock clock) {
        return new RoutingUpdater(config, classifier, clock);
    }

    @Bean
    public ModelInvoker modelInvoker(ModelRegistry registry) {
        return new ModelInvoker(registry);
    }

    @Bean
    public EnsembleFallback ensembleFallback(ModelInvoker invoker, EngineConfig config) {
        return new EnsembleFallback(invoker, config.ensembleSize());
    }

    @Bean
    public ForecastEmitter forecastEmitter(EngineConfig config, ModelInvoker invoker, EnsembleFallback ensemble,
                                           ConfidenceClassifier classifier, HorizonVarianceScaler scaler) {
        return new ForecastEmitter(config, invoker, ensemble, classifier, scaler);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
