package com.routecast.performance.controller;

import com.routecast.common.analytics.ModelLeaderboard;
import com.routecast.common.model.CycleReport;
import com.routecast.performance.dto.RoutingEventDTO;
import com.routecast.performance.dto.RoutingTableRowDTO;
import com.routecast.performance.dto.SeedEntryDTO;
import com.routecast.performance.service.RoutingTableService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/routing")
public class RoutingController {

    private static final Logger log = LoggerFactory.getLogger(RoutingController.class);

    private final RoutingTableService routingTableService;

    public RoutingController(RoutingTableService routingTableService) {
        this.routingTableService = routingTableService;
    }

    @PostMapping("/cycles")
    public Mono<ResponseEntity<CycleReport>> runCycle() {
        log.info("Routing update cycle requested");
        return routingTableService.runCycle()
            .map(ResponseEntity::ok);
    }

    @PostMapping("/seed")
    public Mono<ResponseEntity<Map<String, Object>>> seed(@RequestBody List<SeedEntryDTO> entries) {
        log.info("Routing table seed received. routes={}", entries.size());
        return routingTableService.seed(entries)
            .map(table -> ResponseEntity.ok(Map.<String, Object>of(
                "tableVersion", table.version(),
                "routes", table.size(),
                "tiers", table.tierDistribution())));
    }

    @GetMapping("/table")
    public Flux<RoutingTableRowDTO> table() {
        log.info("Routing table export requested");
        return routingTableService.exportTable();
    }

    @GetMapping("/events")
    public Flux<RoutingEventDTO> events(@RequestParam(required = false) String routeKey) {
        log.info("Routing events requested. routeKey={}", routeKey);
        return routingTableService.events(routeKey);
    }

    @GetMapping("/leaderboard")
    public Mono<ResponseEntity<ModelLeaderboard>> leaderboard() {
        log.info("Model leaderboard requested");
        return routingTableService.leaderboard()
            .map(ResponseEntity::ok);
    }
}
