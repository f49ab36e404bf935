package com.routecast.performance.controller;

import com.routecast.common.analytics.ModelPerformanceSummary;
import com.routecast.common.analytics.PeriodSummary;
import com.routecast.common.config.EngineConfig;
import com.routecast.common.model.EvaluationBatch;
import com.routecast.common.model.IngestionReport;
import com.routecast.common.model.Period;
import com.routecast.performance.dto.ObservationDTO;
import com.routecast.performance.dto.ObservationReportDTO;
import com.routecast.performance.service.LedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/performance")
public class PerformanceController {

    private static final Logger log = LoggerFactory.getLogger(PerformanceController.class);

    private final LedgerService ledgerService;
    private final EngineConfig config;

    public PerformanceController(LedgerService ledgerService, EngineConfig config) {
        this.ledgerService = ledgerService;
        this.config        = config;
    }

    @PostMapping("/batches")
    public Mono<ResponseEntity<IngestionReport>> ingest(@RequestBody EvaluationBatch batch) {
        log.info("Evaluation batch received. period={} routes={}", batch.period(), batch.outcomes().size());
        return ledgerService.ingest(batch)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/observations")
    public Mono<ResponseEntity<ObservationReportDTO>> observations(@RequestBody List<ObservationDTO> observations) {
        log.info("Route observations received. count={}", observations.size());
        return ledgerService.recordObservations(observations)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/models/summary")
    public Mono<ResponseEntity<List<ModelPerformanceSummary>>> modelSummary(
            @RequestParam(required = false) Integer lookback) {
        int periods = lookback == null ? config.lookbackPeriods() : lookback;
        log.info("Model performance summary requested. lookback={}", periods);
        return ledgerService.modelSummary(periods)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/periods/{year}/{week}")
    public Mono<ResponseEntity<PeriodSummary>> periodSummary(@PathVariable int year, @PathVariable int week) {
        log.info("Period summary requested. year={} week={}", year, week);
        return Mono.fromCallable(() -> Period.of(week, year))
            .flatMap(ledgerService::periodSummary)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
