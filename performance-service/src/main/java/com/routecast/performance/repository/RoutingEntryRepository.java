package com.routecast.performance.repository;

import com.routecast.performance.model.RoutingEntryRow;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface RoutingEntryRepository extends ReactiveCrudRepository<RoutingEntryRow, Long> {

    Flux<RoutingEntryRow> findByTableVersionOrderByRouteKey(long tableVersion);

    /**
     * Drops every table version older than {@code oldestRetained}. The published
     * version is always retained.
     */
    @Modifying
    @Query("DELETE FROM routing_entry WHERE table_version < :oldestRetained")
    Mono<Integer> deleteVersionsBefore(long oldestRetained);
}
