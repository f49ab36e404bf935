package com.routecast.performance.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("period_summary")
public class PeriodSummaryRow {

    @Id
    private Long id;

    private int periodWeek;

    private int periodYear;

    private int totalRoutes;

    private int routesWithActuals;

    // null when no route of the period had an actual
    private Double averageMape;

    private Double medianMape;

    private int routesUnderHigh;

    private int routesUnderMedium;

    private String bestModel;

    private String worstModel;

    private LocalDateTime updatedAt;
}
