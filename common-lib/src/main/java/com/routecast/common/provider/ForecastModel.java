package com.routecast.common.provider;

import com.routecast.common.model.Period;
import com.routecast.common.model.RouteObservation;

import java.util.List;

/**
 * A forecasting method. Implementations are registered in a {@link ModelRegistry}
 * under a model id; the routing engine never depends on a concrete method.
 */
@FunctionalInterface
public interface ForecastModel {

    /**
     * @param history      the route's observations, oldest first
     * @param targetPeriod the period to forecast
     * @param productType  the route's product type
     * @return forecast quantity; expected to be finite and &gt;= 0
     */
    double forecast(List<RouteObservation> history, Period targetPeriod, String productType);
}
