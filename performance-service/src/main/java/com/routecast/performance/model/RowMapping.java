package com.routecast.performance.model;

import com.routecast.common.analytics.PeriodSummary;
import com.routecast.common.model.ConfidenceTier;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import com.routecast.common.model.RouteObservation;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.model.RoutingUpdateEvent;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Conversions between persisted rows and engine types. Timestamps are stored as
 * UTC {@link LocalDateTime}.
 */
public final class RowMapping {

    private RowMapping() {}

    public static PerformanceRecord toRecord(PerformanceRecordRow row) {
        return new PerformanceRecord(Route.fromKey(row.getRouteKey()),
                                     Period.of(row.getPeriodWeek(), row.getPeriodYear()),
                                     row.getModelId(), row.getForecastValue(), row.getActualValue(),
                                     row.getErrorPct(), row.getAbsErrorPct(), toInstant(row.getRecordedAt()));
    }

    public static RoutingEntryRow toRow(RoutingEntry entry, long tableVersion) {
        Route route = entry.route();
        RoutingEntryRow row = new RoutingEntryRow();
        row.setTableVersion(tableVersion);
        row.setRouteKey(route.routeKey());
        row.setOrigin(route.origin());
        row.setDestination(route.destination());
        row.setProductType(route.productType());
        row.setDayOfWeek(route.dayOfWeek());
        row.setAssignedModelId(entry.assignedModelId());
        row.setHistoricalErrorPct(entry.historicalErrorPct());
        row.setConfidenceTier(entry.confidenceTier().name());
        if (entry.lastUpdatedPeriod() != null) {
            row.setLastUpdatedWeek(entry.lastUpdatedPeriod().week());
            row.setLastUpdatedYear(entry.lastUpdatedPeriod().year());
        }
        return row;
    }

    public static RoutingEntry toEntry(RoutingEntryRow row) {
        Period lastUpdated = row.getLastUpdatedWeek() == null || row.getLastUpdatedYear() == null
            ? null
            : Period.of(row.getLastUpdatedWeek(), row.getLastUpdatedYear());
        Route route = new Route(row.getOrigin(), row.getDestination(), row.getProductType(), row.getDayOfWeek());
        return new RoutingEntry(route, row.getAssignedModelId(), row.getHistoricalErrorPct(),
                                ConfidenceTier.valueOf(row.getConfidenceTier()), lastUpdated);
    }

    public static RoutingUpdateEventRow toRow(RoutingUpdateEvent event, long tableVersion) {
        RoutingUpdateEventRow row = new RoutingUpdateEventRow();
        row.setTableVersion(tableVersion);
        row.setRouteKey(event.route().routeKey());
        row.setPeriodWeek(event.period().week());
        row.setPeriodYear(event.period().year());
        row.setOldModel(event.oldModel());
        row.setNewModel(event.newModel());
        row.setErrorImprovement(event.errorImprovement());
        row.setReason(event.reason());
        row.setEventTimestamp(toLocal(event.timestamp()));
        return row;
    }

    public static RouteObservation toObservation(RouteObservationRow row) {
        return new RouteObservation(Period.of(row.getPeriodWeek(), row.getPeriodYear()), row.getQuantity());
    }

    public static PeriodSummary toSummary(PeriodSummaryRow row) {
        return new PeriodSummary(Period.of(row.getPeriodWeek(), row.getPeriodYear()),
                                 row.getTotalRoutes(), row.getRoutesWithActuals(),
                                 orNaN(row.getAverageMape()), orNaN(row.getMedianMape()),
                                 row.getRoutesUnderHigh(), row.getRoutesUnderMedium(),
                                 row.getBestModel(), row.getWorstModel());
    }

    /** NaN is not storable; it becomes SQL NULL. */
    public static Double nullIfNaN(double value) {
        return Double.isNaN(value) ? null : value;
    }

    public static LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }

    private static double orNaN(Double value) {
        return value == null ? Double.NaN : value;
    }
}
