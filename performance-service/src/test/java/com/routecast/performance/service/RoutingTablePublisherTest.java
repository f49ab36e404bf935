package com.routecast.performance.service;

import com.routecast.common.exception.LedgerUnavailableException;
import com.routecast.common.exception.RoutingEngineException;
import com.routecast.common.model.ConfidenceTier;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import com.routecast.common.model.RoutingEntry;
import com.routecast.common.model.RoutingUpdateEvent;
import com.routecast.common.routing.RoutingTable;
import com.routecast.performance.model.RoutingEntryRow;
import com.routecast.performance.model.RowMapping;
import com.routecast.performance.repository.RoutingEntryRepository;
import com.routecast.performance.repository.RoutingTableHeadRepository;
import com.routecast.performance.repository.RoutingUpdateEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoutingTablePublisherTest {

    private static final Route ROUTE_R = new Route("ATL", "DFW", "PARCEL", 2);

    @Mock private RoutingEntryRepository entryRepository;
    @Mock private RoutingTableHeadRepository headRepository;
    @Mock private RoutingUpdateEventRepository eventRepository;

    private RoutingTablePublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new RoutingTablePublisher(entryRepository, headRepository, eventRepository);
    }

    private static RoutingTable version4() {
        return RoutingTable.of(4, List.of(
            new RoutingEntry(ROUTE_R, "B", 24.0, ConfidenceTier.MEDIUM, Period.of(2, 2025))));
    }

    private static List<RoutingUpdateEvent> switchEvent() {
        return List.of(new RoutingUpdateEvent(ROUTE_R, Period.of(2, 2025), "A", "B", 6.0,
                                              "Recent performance better by 6.0%",
                                              Instant.parse("2025-03-02T06:00:00Z")));
    }

    @Test
    @DisplayName("loads the version named by the head")
    void loadsPublished() {
        RoutingEntryRow row = RowMapping.toRow(
            new RoutingEntry(ROUTE_R, "A", 7.5, ConfidenceTier.HIGH, Period.of(4, 2025)), 2);
        when(headRepository.findCurrentVersion()).thenReturn(Mono.just(2L));
        when(entryRepository.findByTableVersionOrderByRouteKey(2L)).thenReturn(Flux.just(row));

        StepVerifier.create(publisher.loadPublished())
            .assertNext(table -> {
                assertEquals(2, table.version());
                RoutingEntry entry = table.get(ROUTE_R).orElseThrow();
                assertEquals("A", entry.assignedModelId());
                assertEquals(ConfidenceTier.HIGH, entry.confidenceTier());
                assertEquals(Period.of(4, 2025), entry.lastUpdatedPeriod());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("writes entries and events, then moves the head")
    void publishes() {
        when(entryRepository.saveAll(anyIterable())).thenReturn(Flux.empty());
        when(eventRepository.saveAll(anyIterable())).thenReturn(Flux.empty());
        when(headRepository.advance(3L, 4L)).thenReturn(Mono.just(1));

        RoutingTable next = version4();
        StepVerifier.create(publisher.publish(3L, next, switchEvent()))
            .expectNext(next)
            .verifyComplete();

        verify(headRepository).advance(3L, 4L);
    }

    @Test
    @DisplayName("head already moved → conflict, not a storage error")
    void lostRace() {
        when(entryRepository.saveAll(anyIterable())).thenReturn(Flux.empty());
        when(eventRepository.saveAll(anyIterable())).thenReturn(Flux.empty());
        when(headRepository.advance(3L, 4L)).thenReturn(Mono.just(0));

        StepVerifier.create(publisher.publish(3L, version4(), switchEvent()))
            .expectErrorMatches(e -> e instanceof RoutingEngineException
                                     && !(e instanceof LedgerUnavailableException))
            .verify();
    }

    @Test
    @DisplayName("write failure → LedgerUnavailableException and the head is never touched")
    void writeFailure() {
        when(entryRepository.saveAll(anyIterable())).thenReturn(Flux.error(new IllegalStateException("io")));

        StepVerifier.create(publisher.publish(3L, version4(), switchEvent()))
            .expectError(LedgerUnavailableException.class)
            .verify();

        verifyNoInteractions(headRepository);
    }

    @Test
    @DisplayName("prunes versions older than the retained window only")
    void prunes() {
        when(entryRepository.deleteVersionsBefore(3L)).thenReturn(Mono.just(12));

        StepVerifier.create(publisher.prune(10L)).verifyComplete();
        StepVerifier.create(publisher.prune(5L)).verifyComplete();

        verify(entryRepository).deleteVersionsBefore(3L);
        verifyNoMoreInteractions(entryRepository);
    }
}
