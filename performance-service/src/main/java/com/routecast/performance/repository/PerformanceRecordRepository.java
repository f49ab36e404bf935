package com.routecast.performance.repository;

import com.routecast.performance.model.PerformanceRecordRow;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface PerformanceRecordRepository extends ReactiveCrudRepository<PerformanceRecordRow, Long> {

    /**
     * Idempotent UPSERT on {@code (route_key, period_week, period_year, model_id)}:
     * re-recording the same key replaces the prior values instead of adding a row.
     */
    @Modifying
    @Query("""
        INSERT INTO performance_record
            (route_key, period_week, period_year, model_id, forecast_value, actual_value,
             error_pct, abs_error_pct, recorded_at)
        VALUES
            (:routeKey, :periodWeek, :periodYear, :modelId, :forecastValue, :actualValue,
             :errorPct, :absErrorPct, :recordedAt)
        ON CONFLICT (route_key, period_week, period_year, model_id) DO UPDATE SET
            forecast_value = EXCLUDED.forecast_value,
            actual_value   = EXCLUDED.actual_value,
            error_pct      = EXCLUDED.error_pct,
            abs_error_pct  = EXCLUDED.abs_error_pct,
            recorded_at    = EXCLUDED.recorded_at
        """)
    Mono<Integer> upsertRecord(String routeKey, int periodWeek, int periodYear, String modelId,
                               double forecastValue, double actualValue, double errorPct,
                               double absErrorPct, LocalDateTime recordedAt);

    @Query("SELECT DISTINCT model_id FROM performance_record ORDER BY model_id")
    Flux<String> findDistinctModelIds();
}
