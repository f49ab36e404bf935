package com.routecast.performance.repository;

import com.routecast.performance.model.RoutingTableHead;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface RoutingTableHeadRepository extends ReactiveCrudRepository<RoutingTableHead, Integer> {

    @Query("SELECT current_version FROM routing_table_head WHERE id = 1")
    Mono<Long> findCurrentVersion();

    /**
     * Compare-and-set of the published version.
     *
     * @return rows updated; {@code 0} when another publisher moved the head first
     */
    @Modifying
    @Query("""
        UPDATE routing_table_head
        SET current_version = :nextVersion,
            published_at    = NOW()
        WHERE id = 1 AND current_version = :expectedVersion
        """)
    Mono<Integer> advance(long expectedVersion, long nextVersion);
}
