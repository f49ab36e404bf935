package com.routecast.performance.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted Ledger row. {@code (route_key, period_week, period_year, model_id)} is
 * unique; writes go through the upsert in
 * {@link com.routecast.performance.repository.PerformanceRecordRepository}.
 */
@Data
@NoArgsConstructor
@Table("performance_record")
public class PerformanceRecordRow {

    @Id
    private Long id;

    private String routeKey;

    private int periodWeek;

    private int periodYear;

    private String modelId;

    private double forecastValue;

    private double actualValue;

    private double errorPct;

    private double absErrorPct;

    private LocalDateTime recordedAt;
}
