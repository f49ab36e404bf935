package com.routecast.common.routing;

import com.routecast.common.aggregation.RollingPerformanceAggregator;
import com.routecast.common.confidence.ConfidenceClassifier;
import com.routecast.common.config.EngineConfig;
import com.routecast.common.ledger.LedgerView;
import com.routecast.common.model.CycleReport;
import com.routecast.common.model.Period;
import com.routecast.common.model.RollingError;
import com.routecast.common.model.Route;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.model.RoutingUpdateEvent;
import com.routecast.common.model.TierAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Periodic batch re-evaluation of every routing entry against rolling performance.
 *
 * <h3>Per existing entry</h3>
 * <ol>
 *   <li>Rank every model with data in the route's window ({@code lookbackPeriods}).</li>
 *   <li>No model has data → entry left untouched.</li>
 *   <li>Current model covers fewer than {@code minPeriodsForSwitch} periods → entry left
 *       untouched (insufficient evidence is not grounds for churn).</li>
 *   <li>Best candidate = lowest error among models covering at least
 *       {@code minPeriodsForSwitch} periods; {@code improvement = current − best}.</li>
 *   <li>Switch only when {@code best != current && improvement > switchThresholdPct};
 *       the switch writes a {@link RoutingUpdateEvent}.</li>
 *   <li>Otherwise the current model's rolling error and tier are refreshed.</li>
 * </ol>
 *
 * <h3>Routes without an entry</h3>
 * A route in the ledger with no entry is admitted when its best candidate covers
 * at least {@code minPeriodsForSwitch} periods. Admission is not a switch and
 * writes no event. Otherwise the route stays NEW_ROUTE.
 *
 * <p>Each route is evaluated in isolation: a failure keeps that route's prior
 * entry and is counted, never aborting the cycle.
 */
public class RoutingUpdater {

    private static final Logger log = LoggerFactory.getLogger(RoutingUpdater.class);

    private final EngineConfig config;
    private final ConfidenceClassifier classifier;
    private final Clock clock;

    public RoutingUpdater(EngineConfig config, ConfidenceClassifier classifier, Clock clock) {
        this.config     = config;
        this.classifier = classifier;
        this.clock      = clock;
    }

    public RoutingCycleResult update(RoutingTable current, LedgerView snapshot) {
        RollingPerformanceAggregator aggregator = new RollingPerformanceAggregator(snapshot);
        Map<Route, RoutingEntry> next = new TreeMap<>();
        List<RoutingUpdateEvent> events = new ArrayList<>();
        Counters c = new Counters();

        for (RoutingEntry entry : current.entries()) {
            c.evaluated++;
            try {
                next.put(entry.route(), reevaluate(entry, aggregator, events, c));
            } catch (RuntimeException e) {
                log.warn("ROUTE_UPDATE_FAILED route={} - prior entry kept", entry.route(), e);
                next.put(entry.route(), entry);
                c.failed++;
            }
        }

        for (Route route : snapshot.routes()) {
            if (current.contains(route)) {
                continue;
            }
            c.evaluated++;
            try {
                admit(route, aggregator, c).ifPresent(e -> next.put(route, e));
            } catch (RuntimeException e) {
                log.warn("ROUTE_ADMISSION_FAILED route={} - left as NEW_ROUTE", route, e);
                c.failed++;
            }
        }

        RoutingTable table = RoutingTable.of(current.version() + 1, next.values());
        CycleReport report = new CycleReport(table.version(), c.evaluated, c.switched, c.refreshed, c.created,
                                             c.insufficient, c.noData, c.failed);
        log.info("ROUTING_CYCLE_COMPLETE version={} evaluated={} switched={} refreshed={} created={} "
                 + "insufficientEvidence={} noData={} failed={}",
                 report.tableVersion(), report.routesEvaluated(), report.switched(), report.refreshed(),
                 report.created(), report.skippedInsufficientEvidence(), report.unchangedNoData(), report.failed());
        return new RoutingCycleResult(table, List.copyOf(events), report);
    }

    // ── existing entries ─────────────────────────────────────────────────────

    private RoutingEntry reevaluate(RoutingEntry entry, RollingPerformanceAggregator aggregator,
                                    List<RoutingUpdateEvent> events, Counters c) {
        Route route = entry.route();
        List<RollingError> ranking = aggregator.rank(route, config.lookbackPeriods());
        if (ranking.isEmpty()) {
            c.noData++;
            return entry;
        }

        RollingError currentError = ranking.stream()
            .filter(r -> r.modelId().equals(entry.assignedModelId()))
            .findFirst()
            .orElse(RollingError.none(entry.assignedModelId()));
        if (!currentError.covers(config.minPeriodsForSwitch())) {
            log.debug("INSUFFICIENT_EVIDENCE route={} model={} covered={} required={}",
                      route, entry.assignedModelId(), currentError.periodsCovered(),
                      config.minPeriodsForSwitch());
            c.insufficient++;
            return entry;
        }

        RollingError best = bestCandidate(ranking).orElse(currentError);
        double improvement = currentError.meanAbsErrorPct() - best.meanAbsErrorPct();
        Period latest = aggregator.latestPeriod(route).orElse(entry.lastUpdatedPeriod());

        if (!best.modelId().equals(entry.assignedModelId()) && improvement > config.switchThresholdPct()) {
            TierAssessment tier = classifier.classify(best.meanAbsErrorPct());
            String reason = String.format(Locale.ROOT, "Recent performance better by %.1f%%", improvement);
            events.add(new RoutingUpdateEvent(route, latest, entry.assignedModelId(), best.modelId(),
                                              improvement, reason, clock.instant()));
            log.info("ROUTE_MODEL_SWITCHED route={} from={} to={} improvement={} tier={}",
                     route, entry.assignedModelId(), best.modelId(),
                     String.format(Locale.ROOT, "%.2f", improvement), tier.tier());
            c.switched++;
            return new RoutingEntry(route, best.modelId(), best.meanAbsErrorPct(), tier.tier(), latest);
        }

        TierAssessment tier = classifier.classify(currentError.meanAbsErrorPct());
        c.refreshed++;
        return new RoutingEntry(route, entry.assignedModelId(), currentError.meanAbsErrorPct(), tier.tier(), latest);
    }

    // ── new routes ───────────────────────────────────────────────────────────

    private Optional<RoutingEntry> admit(Route route, RollingPerformanceAggregator aggregator, Counters c) {
        List<RollingError> ranking = aggregator.rank(route, config.lookbackPeriods());
        if (ranking.isEmpty()) {
            c.noData++;
            return Optional.empty();
        }
        Optional<RollingError> best = bestCandidate(ranking);
        if (best.isEmpty()) {
            c.insufficient++;
            return Optional.empty();
        }
        RollingError winner = best.get();
        TierAssessment tier = classifier.classify(winner.meanAbsErrorPct());
        Period latest = aggregator.latestPeriod(route).orElse(null);
        log.info("ROUTE_ADMITTED route={} model={} error={} tier={}",
                 route, winner.modelId(), String.format(Locale.ROOT, "%.2f", winner.meanAbsErrorPct()), tier.tier());
        c.created++;
        return Optional.of(new RoutingEntry(route, winner.modelId(), winner.meanAbsErrorPct(), tier.tier(), latest));
    }

    /** Ranking is already best-first; the first model with enough coverage wins. */
    private Optional<RollingError> bestCandidate(List<RollingError> ranking) {
        return ranking.stream()
            .filter(r -> r.covers(config.minPeriodsForSwitch()))
            .findFirst();
    }

    private static final class Counters {
        int evaluated;
        int switched;
        int refreshed;
        int created;
        int insufficient;
        int noData;
        int failed;
    }
}
