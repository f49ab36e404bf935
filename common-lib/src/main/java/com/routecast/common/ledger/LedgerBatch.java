package com.routecast.common.ledger;

import com.routecast.common.model.IngestionReport;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Period;

import java.util.List;

/**
 * Records derived from one evaluation batch, plus what was left out and why.
 *
 * @param missingActualRouteKeys routes excluded because no usable actual was supplied
 * @param forecastsRejected      individual model forecasts dropped as invalid (NaN, infinite, absent)
 */
public record LedgerBatch(
    Period                  period,
    int                     routesReceived,
    List<PerformanceRecord> records,
    List<String>            missingActualRouteKeys,
    int                     forecastsRejected
) {

    public int routesRecorded() {
        return (int) records.stream().map(r -> r.route().routeKey()).distinct().count();
    }

    public IngestionReport toReport() {
        return new IngestionReport(period, routesReceived, routesRecorded(),
                                   missingActualRouteKeys.size(), records.size(), forecastsRejected);
    }
}
