package com.routecast.performance.service;

import com.routecast.common.confidence.ConfidenceClassifier;
import com.routecast.common.confidence.HorizonVarianceScaler;
import com.routecast.common.config.EngineConfig;
import com.routecast.common.emission.ForecastEmitter;
import com.routecast.common.ensemble.EnsembleFallback;
import com.routecast.common.ledger.LedgerSnapshot;
import com.routecast.common.model.ConfidenceTier;
import com.routecast.common.model.ForecastEmission;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.provider.ModelInvoker;
import com.routecast.common.provider.ModelRegistry;
import com.routecast.common.routing.RoutingTable;
import com.routecast.performance.dto.ForecastRequestDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForecastServiceTest {

    private static final Route ROUTE_R = new Route("ATL", "DFW", "PARCEL", 2);
    private static final Route ROUTE_S = new Route("ORD", "LAX", "FREIGHT", 5);

    @Mock private LedgerService ledgerService;
    @Mock private RoutingTablePublisher publisher;

    private ForecastService service;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.defaults();
        ModelInvoker invoker = new ModelInvoker(ModelRegistry.builder()
            .register(EngineConfig.DEFAULT_MODEL_ID, (h, t, p) -> 50.0)
            .register("A", (h, t, p) -> 80.0)
            .build());
        ForecastEmitter emitter = new ForecastEmitter(config, invoker,
                                                      new EnsembleFallback(invoker, config.ensembleSize()),
                                                      new ConfidenceClassifier(config),
                                                      new HorizonVarianceScaler(config.horizonStep()));
        service = new ForecastService(ledgerService, publisher, emitter);
    }

    private void stubState() {
        RoutingTable table = RoutingTable.of(2, List.of(
            new RoutingEntry(ROUTE_R, "A", 7.5, ConfidenceTier.HIGH, Period.of(4, 2025))));
        LedgerSnapshot ledger = LedgerSnapshot.of(List.of(
            new PerformanceRecord(ROUTE_S, Period.of(4, 2025), "A", 110, 100, 10.0, 10.0,
                                  Instant.parse("2025-03-02T06:00:00Z"))));
        when(publisher.loadPublished()).thenReturn(Mono.just(table));
        when(ledgerService.snapshot()).thenReturn(Mono.just(ledger));
        when(ledgerService.histories(anyCollection())).thenReturn(Mono.just(Map.of()));
    }

    @Test
    @DisplayName("without route keys, emits for table routes and ledger routes at one week ahead")
    void defaultRoutes() {
        stubState();

        StepVerifier.create(service.emit(new ForecastRequestDTO(5, 2025, null, null)))
            .assertNext(batch -> {
                assertEquals(2, batch.emissions().size());
                ForecastEmission r = batch.emissions().stream()
                    .filter(e -> e.routeKey().equals(ROUTE_R.routeKey())).findFirst().orElseThrow();
                assertEquals("A", r.modelId());
                assertEquals(1, r.weeksAhead());
                ForecastEmission s = batch.emissions().stream()
                    .filter(e -> e.routeKey().equals(ROUTE_S.routeKey())).findFirst().orElseThrow();
                assertEquals(EngineConfig.DEFAULT_MODEL_ID, s.modelId());
                assertEquals(ConfidenceTier.NEW_ROUTE, s.confidenceTier());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("explicit route keys restrict emission")
    void explicitRoutes() {
        stubState();

        StepVerifier.create(service.emit(new ForecastRequestDTO(5, 2025, 3, List.of(ROUTE_R.routeKey()))))
            .assertNext(batch -> {
                assertEquals(3, batch.emissions().size());
                assertTrue(batch.emissions().stream().allMatch(e -> e.routeKey().equals(ROUTE_R.routeKey())));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("invalid target week is rejected before any read")
    void invalidPeriod() {
        StepVerifier.create(service.emit(new ForecastRequestDTO(0, 2025, 1, null)))
            .expectError(IllegalArgumentException.class)
            .verify();

        verifyNoInteractions(publisher, ledgerService);
    }
}
