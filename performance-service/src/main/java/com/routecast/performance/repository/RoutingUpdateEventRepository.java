package com.routecast.performance.repository;

import com.routecast.performance.model.RoutingUpdateEventRow;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface RoutingUpdateEventRepository extends ReactiveCrudRepository<RoutingUpdateEventRow, Long> {

    Flux<RoutingUpdateEventRow> findByRouteKeyOrderByEventTimestampDesc(String routeKey);

    Flux<RoutingUpdateEventRow> findAllByOrderByEventTimestampDesc();
}
