package com.routecast.performance.service;

import com.routecast.common.analytics.ModelPerformanceSummary;
import com.routecast.common.analytics.PerformanceAnalytics;
import com.routecast.common.analytics.PeriodSummary;
import com.routecast.common.config.EngineConfig;
import com.routecast.common.exception.LedgerUnavailableException;
import com.routecast.common.ledger.BatchEvaluator;
import com.routecast.common.ledger.LedgerBatch;
import com.routecast.common.ledger.LedgerSnapshot;
import com.routecast.common.model.EvaluationBatch;
import com.routecast.common.model.IngestionReport;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import com.routecast.common.model.RouteObservation;
import com.routecast.performance.dto.ObservationDTO;
import com.routecast.performance.dto.ObservationReportDTO;
import com.routecast.performance.model.RowMapping;
import com.routecast.performance.repository.PerformanceRecordRepository;
import com.routecast.performance.repository.PeriodSummaryRepository;
import com.routecast.performance.repository.RouteObservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Persisted Performance Ledger plus the route history and accuracy summaries derived from it.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final LedgerWriter writer;
    private final BatchEvaluator evaluator;
    private final EngineConfig config;
    private final PerformanceRecordRepository recordRepository;
    private final PeriodSummaryRepository summaryRepository;
    private final RouteObservationRepository observationRepository;

    public LedgerService(LedgerWriter writer,
                         BatchEvaluator evaluator,
                         EngineConfig config,
                         PerformanceRecordRepository recordRepository,
                         PeriodSummaryRepository summaryRepository,
                         RouteObservationRepository observationRepository) {
        this.writer                = writer;
        this.evaluator             = evaluator;
        this.config                = config;
        this.recordRepository      = recordRepository;
        this.summaryRepository     = summaryRepository;
        this.observationRepository = observationRepository;
    }

    // ── ingestion ────────────────────────────────────────────────────────────

    /**
     * Evaluates and upserts one evaluation batch. Safe to retry with the same batch.
     * The period summary is refreshed afterwards; its failure does not fail ingestion.
     */
    public Mono<IngestionReport> ingest(EvaluationBatch batch) {
        return Mono.fromCallable(() -> evaluator.evaluate(batch))
            .flatMap(prepared -> writer.upsertAll(prepared.records())
                .onErrorMap(e -> !(e instanceof LedgerUnavailableException),
                            e -> new LedgerUnavailableException(
                                "ledger write failed for period " + prepared.period(), e))
                .then(Mono.defer(() -> storePeriodSummary(prepared)))
                .thenReturn(prepared.toReport()))
            .doOnSuccess(r -> log.info("LEDGER_BATCH_INGESTED period={} received={} recorded={} "
                                       + "missingActual={} records={} rejected={}",
                                       r.period(), r.routesReceived(), r.routesRecorded(),
                                       r.routesMissingActual(), r.recordsWritten(), r.forecastsRejected()))
            .doOnError(e -> log.error("Ledger ingestion failed. period={}", batch.period(), e));
    }

    private Mono<Void> storePeriodSummary(LedgerBatch prepared) {
        PeriodSummary s = PerformanceAnalytics.summarizePeriod(prepared, config);
        return summaryRepository.upsertSummary(
                s.period().week(), s.period().year(), s.totalRoutes(), s.routesWithActuals(),
                RowMapping.nullIfNaN(s.averageMape()), RowMapping.nullIfNaN(s.medianMape()),
                s.routesUnderHigh(), s.routesUnderMedium(), s.bestModel(), s.worstModel())
            .then()
            .onErrorResume(e -> {
                log.warn("Period summary refresh failed (non-fatal). period={}", prepared.period(), e);
                return Mono.empty();
            });
    }

    // ── reads ────────────────────────────────────────────────────────────────

    /** Consistent point-in-time view of the whole Ledger. */
    public Mono<LedgerSnapshot> snapshot() {
        return writer.snapshot()
            .onErrorMap(e -> !(e instanceof LedgerUnavailableException),
                        e -> new LedgerUnavailableException("ledger snapshot could not be read", e));
    }

    public Mono<Set<String>> modelIds() {
        return recordRepository.findDistinctModelIds()
            .collectList()
            .<Set<String>>map(TreeSet::new);
    }

    public Mono<List<ModelPerformanceSummary>> modelSummary(int lookback) {
        return snapshot().map(s -> PerformanceAnalytics.summarizeModels(s, lookback));
    }

    public Mono<PeriodSummary> periodSummary(Period period) {
        return summaryRepository.findByPeriodYearAndPeriodWeek(period.year(), period.week())
            .map(RowMapping::toSummary);
    }

    // ── route history ────────────────────────────────────────────────────────

    public Mono<ObservationReportDTO> recordObservations(List<ObservationDTO> observations) {
        return Flux.fromIterable(observations)
            .map(this::validate)
            .collectList()
            .flatMapMany(Flux::fromIterable)
            .concatMap(o -> observationRepository.upsertObservation(o.routeKey(), o.week(), o.year(), o.quantity()))
            .reduce(0, Integer::sum)
            .map(written -> new ObservationReportDTO(observations.size(), written))
            .doOnSuccess(r -> log.info("Route observations upserted. received={} written={}",
                                       r.received(), r.written()));
    }

    /** Every route's observations, oldest first; a route without history maps to an empty list. */
    public Mono<Map<Route, List<RouteObservation>>> histories(Collection<Route> routes) {
        return Flux.fromIterable(routes)
            .concatMap(route -> observationRepository
                .findByRouteKeyOrderByPeriodYearAscPeriodWeekAsc(route.routeKey())
                .map(RowMapping::toObservation)
                .collectList()
                .map(history -> Map.entry(route, history)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private ObservationDTO validate(ObservationDTO o) {
        Route route = Route.fromKey(o.routeKey());
        Period.of(o.week(), o.year());
        if (!Double.isFinite(o.quantity()) || o.quantity() < 0.0) {
            throw new IllegalArgumentException("quantity must be finite and >= 0 for route "
                                               + route + ", got " + o.quantity());
        }
        return new ObservationDTO(route.routeKey(), o.week(), o.year(), o.quantity());
    }
}
