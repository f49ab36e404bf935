package com.routecast.performance.service;

import com.routecast.common.emission.EmissionBatch;
import com.routecast.common.emission.ForecastEmitter;
import com.routecast.common.ledger.LedgerSnapshot;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.routing.RoutingTable;
import com.routecast.performance.dto.ForecastRequestDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.TreeSet;

/**
 * Forecast emission against the published routing table.
 */
@Service
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final LedgerService ledgerService;
    private final RoutingTablePublisher publisher;
    private final ForecastEmitter emitter;

    public ForecastService(LedgerService ledgerService, RoutingTablePublisher publisher, ForecastEmitter emitter) {
        this.ledgerService = ledgerService;
        this.publisher     = publisher;
        this.emitter       = emitter;
    }

    public Mono<EmissionBatch> emit(ForecastRequestDTO request) {
        return Mono.fromCallable(() -> Period.of(request.week(), request.year()))
            .flatMap(target -> Mono.zip(publisher.loadPublished(), ledgerService.snapshot())
                .flatMap(t -> {
                    RoutingTable table = t.getT1();
                    LedgerSnapshot ledger = t.getT2();
                    Set<Route> routes = requestedRoutes(request, table, ledger);
                    int weeksAhead = request.weeksAhead() == null ? 1 : request.weeksAhead();
                    return ledgerService.histories(routes)
                        .map(histories -> emitter.emit(table, ledger, histories, target, weeksAhead, routes));
                }))
            .doOnSuccess(b -> log.info("FORECASTS_EMITTED target={}-W{} emissions={} skipped={} ensembles={}",
                                       request.year(), request.week(), b.emissions().size(),
                                       b.skippedRouteKeys().size(), b.ensembleCount()))
            .doOnError(e -> log.error("Forecast emission failed. target={}-W{}", request.year(), request.week(), e));
    }

    private static Set<Route> requestedRoutes(ForecastRequestDTO request, RoutingTable table, LedgerSnapshot ledger) {
        Set<Route> routes = new TreeSet<>();
        if (request.routeKeys() != null && !request.routeKeys().isEmpty()) {
            request.routeKeys().forEach(key -> routes.add(Route.fromKey(key)));
            return routes;
        }
        table.entries().stream().map(RoutingEntry::route).forEach(routes::add);
        routes.addAll(ledger.routes());
        return routes;
    }
}
