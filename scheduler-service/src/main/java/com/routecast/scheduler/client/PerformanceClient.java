package com.routecast.scheduler.client;

import com.routecast.common.model.CycleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Triggers routing update cycles on performance-service.
 *
 * <p>A 409 means another cycle published first; it completes empty. Every other
 * failure is signalled so the scheduler can fall back to its retry interval.
 */
@Component
public class PerformanceClient {

    private static final Logger log = LoggerFactory.getLogger(PerformanceClient.class);

    private final WebClient performanceWebClient;

    public PerformanceClient(WebClient performanceWebClient) {
        this.performanceWebClient = performanceWebClient;
    }

    public Mono<CycleReport> runCycle(String traceId) {
        return performanceWebClient.post()
            .uri("/api/v1/routing/cycles")
            .header("X-Trace-Id", traceId)
            .retrieve()
            .bodyToMono(CycleReport.class)
            .onErrorResume(WebClientResponseException.class, e -> {
                if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                    log.warn("Tracking cycle superseded by a concurrent publish. traceId={}", traceId);
                    return Mono.empty();
                }
                return Mono.error(e);
            })
            .doOnError(e -> log.error("Tracking cycle call failed. traceId={} reason={}", traceId, e.getMessage()));
    }
}
