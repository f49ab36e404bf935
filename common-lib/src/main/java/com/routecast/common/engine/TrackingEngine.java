package com.routecast.common.engine;

import com.routecast.common.confidence.ConfidenceClassifier;
import com.routecast.common.confidence.HorizonVarianceScaler;
import com.routecast.common.config.EngineConfig;
import com.routecast.common.emission.EmissionBatch;
import com.routecast.common.emission.ForecastEmitter;
import com.routecast.common.ensemble.EnsembleFallback;
import com.routecast.common.ledger.BatchEvaluator;
import com.routecast.common.ledger.LedgerBatch;
import com.routecast.common.ledger.LedgerSnapshot;
import com.routecast.common.ledger.LedgerStore;
import com.routecast.common.ledger.PerformanceLedger;
import com.routecast.common.model.CycleReport;
import com.routecast.common.model.EvaluationBatch;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import com.routecast.common.model.RouteObservation;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.model.RoutingUpdateEvent;
import com.routecast.common.provider.ModelInvoker;
import com.routecast.common.provider.ModelRegistry;
import com.routecast.common.routing.RoutingCycleResult;
import com.routecast.common.routing.RoutingTable;
import com.routecast.common.routing.RoutingUpdater;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-process tracking pipeline wired from one {@link EngineConfig}:
 * ingest → update cycle → emit.
 *
 * <p>The routing table is republished with a compare-and-set: a cycle that loses
 * the race to another cycle, or fails midway, leaves the published table as it was.
 * The update cycle reads one ledger snapshot, so it never observes an ingestion
 * batch that is still being written.
 */
public class TrackingEngine {

    private final EngineConfig config;
    private final PerformanceLedger ledger;
    private final RoutingUpdater updater;
    private final ForecastEmitter emitter;
    private final AtomicReference<RoutingTable> published = new AtomicReference<>(RoutingTable.empty());
    private final List<RoutingUpdateEvent> auditLog = new CopyOnWriteArrayList<>();

    public TrackingEngine(EngineConfig config, LedgerStore store, ModelRegistry registry, Clock clock) {
        ConfidenceClassifier classifier = new ConfidenceClassifier(config);
        ModelInvoker invoker = new ModelInvoker(registry);
        this.config  = config;
        this.ledger  = new PerformanceLedger(store, new BatchEvaluator(config, clock));
        this.updater = new RoutingUpdater(config, classifier, clock);
        this.emitter = new ForecastEmitter(config, invoker, new EnsembleFallback(invoker, config.ensembleSize()),
                                           classifier, new HorizonVarianceScaler(config.horizonStep()));
    }

    public PerformanceLedger ledger() {
        return ledger;
    }

    public LedgerBatch ingest(EvaluationBatch batch) {
        return ledger.recordBatch(batch);
    }

    public CycleReport runCycle() {
        RoutingTable current = published.get();
        LedgerSnapshot snapshot = ledger.snapshot();
        RoutingCycleResult result = updater.update(current, snapshot);
        if (!published.compareAndSet(current, result.table())) {
            throw new IllegalStateException("routing table changed during cycle; version "
                                            + current.version() + " is no longer current");
        }
        auditLog.addAll(result.events());
        return result.report();
    }

    /** Publishes a seeded table as the next version. */
    public RoutingTable seed(Collection<RoutingEntry> entries) {
        return published.updateAndGet(t -> RoutingTable.of(t.version() + 1, entries));
    }

    public EmissionBatch emit(Map<Route, List<RouteObservation>> histories, Period target, int weeksAhead,
                              Collection<Route> routes) {
        return emitter.emit(published.get(), ledger.snapshot(), histories, target, weeksAhead, routes);
    }

    public RoutingTable routingTable() {
        return published.get();
    }

    public List<RoutingUpdateEvent> events() {
        return List.copyOf(auditLog);
    }

    public EngineConfig config() {
        return config;
    }
}
