package com.routecast.performance.controller;

import com.routecast.common.exception.RoutingEngineException;
import com.routecast.common.model.ConfidenceTier;
import com.routecast.common.model.CycleReport;
import com.routecast.common.model.Route;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.routing.RoutingTable;
import com.routecast.performance.dto.RoutingTableRowDTO;
import com.routecast.performance.service.RoutingTableService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoutingControllerTest {

    private static final Route ROUTE_R = new Route("ATL", "DFW", "PARCEL", 2);

    @Mock private RoutingTableService routingTableService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new RoutingController(routingTableService))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("POST /cycles returns the cycle report")
    void runsCycle() {
        when(routingTableService.runCycle()).thenReturn(Mono.just(new CycleReport(4, 2, 1, 1, 0, 0, 0, 0)));

        client.post().uri("/api/v1/routing/cycles")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.tableVersion").isEqualTo(4)
            .jsonPath("$.switched").isEqualTo(1);
    }

    @Test
    @DisplayName("lost publish race maps to 409")
    void conflict() {
        when(routingTableService.runCycle())
            .thenReturn(Mono.error(new RoutingEngineException("routing table version 3 is no longer current")));

        client.post().uri("/api/v1/routing/cycles")
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.error").isEqualTo("Conflict");
    }

    @Test
    @DisplayName("POST /seed reports version and tier distribution")
    void seeds() {
        RoutingTable seeded = RoutingTable.of(1, List.of(new RoutingEntry(ROUTE_R, "A", 8.0, ConfidenceTier.HIGH, null)));
        when(routingTableService.seed(anyList())).thenReturn(Mono.just(seeded));

        client.post().uri("/api/v1/routing/seed")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("[{\"routeKey\": \"ATL|DFW|PARCEL|2\", \"modelId\": \"A\", \"historicalErrorPct\": 8.0}]")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.tableVersion").isEqualTo(1)
            .jsonPath("$.routes").isEqualTo(1)
            .jsonPath("$.tiers.HIGH").isEqualTo(1);
    }

    @Test
    @DisplayName("GET /table streams the published rows")
    void exportsTable() {
        when(routingTableService.exportTable()).thenReturn(Flux.just(
            new RoutingTableRowDTO(ROUTE_R.routeKey(), "ATL", "DFW", "PARCEL", 2, "A", 8.0, ConfidenceTier.HIGH, 1)));

        client.get().uri("/api/v1/routing/table")
            .exchange()
            .expectStatus().isOk()
            .expectBodyList(RoutingTableRowDTO.class)
            .hasSize(1);
    }

    @Test
    @DisplayName("malformed route key → 400")
    void badRouteKey() {
        when(routingTableService.events("nope"))
            .thenThrow(new IllegalArgumentException("route key must have four segments: nope"));

        client.get().uri(uri -> uri.path("/api/v1/routing/events").queryParam("routeKey", "nope").build())
            .exchange()
            .expectStatus().isBadRequest();
    }
}
