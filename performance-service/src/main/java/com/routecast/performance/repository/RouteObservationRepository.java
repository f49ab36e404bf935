package com.routecast.performance.repository;

import com.routecast.performance.model.RouteObservationRow;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface RouteObservationRepository extends ReactiveCrudRepository<RouteObservationRow, Long> {

    Flux<RouteObservationRow> findByRouteKeyOrderByPeriodYearAscPeriodWeekAsc(String routeKey);

    @Modifying
    @Query("""
        INSERT INTO route_observation (route_key, period_week, period_year, quantity, updated_at)
        VALUES (:routeKey, :periodWeek, :periodYear, :quantity, NOW())
        ON CONFLICT (route_key, period_week, period_year) DO UPDATE SET
            quantity   = EXCLUDED.quantity,
            updated_at = NOW()
        """)
    Mono<Integer> upsertObservation(String routeKey, int periodWeek, int periodYear, double quantity);
}
