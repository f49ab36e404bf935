package com.routecast.performance.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One route of one routing table version. Versions are immutable once written;
 * {@link RoutingTableHead} names the published one.
 */
@Data
@NoArgsConstructor
@Table("routing_entry")
public class RoutingEntryRow {

    @Id
    private Long id;

    private long tableVersion;

    private String routeKey;

    private String origin;

    private String destination;

    private String productType;

    private int dayOfWeek;

    private String assignedModelId;

    private double historicalErrorPct;

    private String confidenceTier;

    private Integer lastUpdatedWeek;

    private Integer lastUpdatedYear;
}
