package com.routecast.scheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.routecast.scheduler.strategy.CycleTempoStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class SchedulerConfig {

    @Value("${services.performance.base-url}")
    private String performanceUrl;

    @Value("${scheduler.cycle-interval:P7D}")
    private Duration cycleInterval;

    @Value("${scheduler.retry-interval:PT1H}")
    private Duration retryInterval;

    @Bean
    public WebClient performanceWebClient(WebClient.Builder builder) {
        return builder.baseUrl(performanceUrl).build();
    }

    @Bean
    public CycleTempoStrategy cycleTempoStrategy() {
        return new CycleTempoStrategy(cycleInterval, retryInterval);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
