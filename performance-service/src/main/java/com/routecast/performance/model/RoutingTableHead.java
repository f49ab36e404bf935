package com.routecast.performance.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Single-row pointer to the published routing table version. Moving it is the
 * atomic republish step of an update cycle.
 */
@Data
@NoArgsConstructor
@Table("routing_table_head")
public class RoutingTableHead {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id;

    private long currentVersion;

    private LocalDateTime publishedAt;
}
