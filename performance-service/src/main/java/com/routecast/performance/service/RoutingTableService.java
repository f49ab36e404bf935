package com.routecast.performance.service;

import com.routecast.common.analytics.ModelLeaderboard;
import com.routecast.common.analytics.PerformanceAnalytics;
import com.routecast.common.confidence.ConfidenceClassifier;
import com.routecast.common.model.CycleReport;
import com.routecast.common.model.Route;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.provider.ModelInvoker;
import com.routecast.common.routing.RoutingCycleResult;
import com.routecast.common.routing.RoutingTable;
import com.routecast.common.routing.RoutingUpdater;
import com.routecast.performance.dto.RoutingEventDTO;
import com.routecast.performance.dto.RoutingTableRowDTO;
import com.routecast.performance.dto.SeedEntryDTO;
import com.routecast.performance.model.RoutingUpdateEventRow;
import com.routecast.performance.repository.RoutingUpdateEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs routing update cycles against the persisted Ledger and serves the published table.
 */
@Service
public class RoutingTableService {

    private static final Logger log = LoggerFactory.getLogger(RoutingTableService.class);

    private final LedgerService ledgerService;
    private final RoutingTablePublisher publisher;
    private final RoutingUpdater updater;
    private final ConfidenceClassifier classifier;
    private final RoutingUpdateEventRepository eventRepository;

    public RoutingTableService(LedgerService ledgerService,
                               RoutingTablePublisher publisher,
                               RoutingUpdater updater,
                               ConfidenceClassifier classifier,
                               RoutingUpdateEventRepository eventRepository) {
        this.ledgerService   = ledgerService;
        this.publisher       = publisher;
        this.updater         = updater;
        this.classifier      = classifier;
        this.eventRepository = eventRepository;
    }

    /**
     * One tracking cycle: published table + Ledger snapshot → updater → publish v+1.
     * Any failure leaves the published table as it was.
     */
    public Mono<CycleReport> runCycle() {
        return Mono.zip(publisher.loadPublished(), ledgerService.snapshot())
            .flatMap(t -> {
                RoutingTable current = t.getT1();
                RoutingCycleResult result = updater.update(current, t.getT2());
                return publisher.publish(current.version(), result.table(), result.events())
                    .flatMap(published -> publisher.prune(published.version()))
                    .thenReturn(result.report());
            })
            .doOnSuccess(r -> log.info("TRACKING_CYCLE_COMPLETE version={} switched={} created={} failed={}",
                                       r.tableVersion(), r.switched(), r.created(), r.failed()))
            .doOnError(e -> log.error("Routing update cycle failed; published table unchanged", e));
    }

    /**
     * Publishes a table built from backtest winners. Tiers are classified from each
     * entry's error; events are not written because no switch occurred.
     */
    public Mono<RoutingTable> seed(List<SeedEntryDTO> seeds) {
        return Mono.fromCallable(() -> seeds.stream().map(this::toEntry).toList())
            .flatMap(entries -> publisher.loadPublished()
                .flatMap(current -> publisher.publish(current.version(),
                                                      RoutingTable.of(current.version() + 1, entries),
                                                      List.of())))
            .doOnSuccess(t -> log.info("Routing table seeded. version={} routes={} tiers={}",
                                       t.version(), t.size(), t.tierDistribution()));
    }

    public Flux<RoutingTableRowDTO> exportTable() {
        return publisher.loadPublished()
            .flatMapMany(table -> Flux.fromIterable(table.entries())
                .map(e -> toRow(e, table.version())));
    }

    /** Audit events, newest first; all routes when {@code routeKey} is null or blank. */
    public Flux<RoutingEventDTO> events(String routeKey) {
        Flux<RoutingUpdateEventRow> rows = routeKey == null || routeKey.isBlank()
            ? eventRepository.findAllByOrderByEventTimestampDesc()
            : eventRepository.findByRouteKeyOrderByEventTimestampDesc(Route.fromKey(routeKey).routeKey());
        return rows.map(r -> new RoutingEventDTO(r.getRouteKey(), r.getPeriodWeek(), r.getPeriodYear(),
                                                 r.getOldModel(), r.getNewModel(), r.getErrorImprovement(),
                                                 r.getReason(), r.getTableVersion(), r.getEventTimestamp()));
    }

    public Mono<ModelLeaderboard> leaderboard() {
        return Mono.zip(publisher.loadPublished(), ledgerService.modelIds())
            .map(t -> PerformanceAnalytics.leaderboard(t.getT1(), t.getT2()));
    }

    private RoutingEntry toEntry(SeedEntryDTO seed) {
        Route route = Route.fromKey(seed.routeKey());
        double error = seed.historicalErrorPct();
        if (!Double.isFinite(error) || error < 0.0) {
            throw new IllegalArgumentException("historicalErrorPct must be finite and >= 0 for route "
                                               + route + ", got " + error);
        }
        if (ModelInvoker.isEnsembleId(seed.modelId())) {
            throw new IllegalArgumentException("route " + route + " cannot be seeded with synthetic model "
                                               + seed.modelId());
        }
        return new RoutingEntry(route, seed.modelId(), error, classifier.classify(error).tier(), null);
    }

    private static RoutingTableRowDTO toRow(RoutingEntry e, long version) {
        Route r = e.route();
        return new RoutingTableRowDTO(r.routeKey(), r.origin(), r.destination(), r.productType(), r.dayOfWeek(),
                                      e.assignedModelId(), e.historicalErrorPct(), e.confidenceTier(), version);
    }
}
