package com.routecast.performance.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only audit row, written only when a cycle switches a route's model.
 */
@Data
@NoArgsConstructor
@Table("routing_update_event")
public class RoutingUpdateEventRow {

    @Id
    private Long id;

    private long tableVersion;

    private String routeKey;

    private int periodWeek;

    private int periodYear;

    private String oldModel;

    private String newModel;

    private double errorImprovement;

    private String reason;

    private LocalDateTime eventTimestamp;
}
