package com.routecast.performance.repository;

import com.routecast.performance.model.PeriodSummaryRow;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface PeriodSummaryRepository extends ReactiveCrudRepository<PeriodSummaryRow, Long> {

    Mono<PeriodSummaryRow> findByPeriodYearAndPeriodWeek(int periodYear, int periodWeek);

    @Modifying
    @Query("""
        INSERT INTO period_summary
            (period_week, period_year, total_routes, routes_with_actuals, average_mape, median_mape,
             routes_under_high, routes_under_medium, best_model, worst_model, updated_at)
        VALUES
            (:periodWeek, :periodYear, :totalRoutes, :routesWithActuals, :averageMape, :medianMape,
             :routesUnderHigh, :routesUnderMedium, :bestModel, :worstModel, NOW())
        ON CONFLICT (period_week, period_year) DO UPDATE SET
            total_routes        = EXCLUDED.total_routes,
            routes_with_actuals = EXCLUDED.routes_with_actuals,
            average_mape        = EXCLUDED.average_mape,
            median_mape         = EXCLUDED.median_mape,
            routes_under_high   = EXCLUDED.routes_under_high,
            routes_under_medium = EXCLUDED.routes_under_medium,
            best_model          = EXCLUDED.best_model,
            worst_model         = EXCLUDED.worst_model,
            updated_at          = NOW()
        """)
    Mono<Integer> upsertSummary(int periodWeek, int periodYear, int totalRoutes, int routesWithActuals,
                                Double averageMape, Double medianMape, int routesUnderHigh,
                                int routesUnderMedium, String bestModel, String worstModel);
}
