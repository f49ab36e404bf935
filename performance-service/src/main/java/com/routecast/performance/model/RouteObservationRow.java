package com.routecast.performance.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Weekly shipped quantity of one route; the history handed to forecasting methods.
 */
@Data
@NoArgsConstructor
@Table("route_observation")
public class RouteObservationRow {

    @Id
    private Long id;

    private String routeKey;

    private int periodWeek;

    private int periodYear;

    private double quantity;

    private LocalDateTime updatedAt;
}
