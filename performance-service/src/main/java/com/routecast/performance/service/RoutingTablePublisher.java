package com.routecast.performance.service;

import com.routecast.common.exception.LedgerUnavailableException;
import com.routecast.common.exception.RoutingEngineException;
import com.routecast.common.model.RoutingUpdateEvent;
import com.routecast.common.routing.RoutingTable;
import com.routecast.performance.model.RoutingEntryRow;
import com.routecast.performance.model.RoutingUpdateEventRow;
import com.routecast.performance.model.RowMapping;
import com.routecast.performance.repository.RoutingEntryRepository;
import com.routecast.performance.repository.RoutingTableHeadRepository;
import com.routecast.performance.repository.RoutingUpdateEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Versioned storage of the Routing Table.
 *
 * <h3>Publish protocol</h3>
 * <pre>
 *   BEGIN
 *     INSERT routing_entry rows of version v+1
 *     INSERT routing_update_event rows
 *     UPDATE routing_table_head SET current_version = v+1 WHERE current_version = v
 *   COMMIT            (head moved → new table visible as a whole)
 *   prune versions older than the retained window
 * </pre>
 * If the head moved in the meantime, zero rows are updated and the transaction is
 * rolled back: readers keep seeing version v, never a partial table.
 */
@Component
public class RoutingTablePublisher {

    private static final Logger log = LoggerFactory.getLogger(RoutingTablePublisher.class);

    private final RoutingEntryRepository entryRepository;
    private final RoutingTableHeadRepository headRepository;
    private final RoutingUpdateEventRepository eventRepository;

    @Value("${routing.engine.retained-table-versions:8}")
    private int retainedVersions = 8;

    public RoutingTablePublisher(RoutingEntryRepository entryRepository,
                                 RoutingTableHeadRepository headRepository,
                                 RoutingUpdateEventRepository eventRepository) {
        this.entryRepository = entryRepository;
        this.headRepository  = headRepository;
        this.eventRepository = eventRepository;
    }

    /** The currently published table; version 0 and empty before the first publish. */
    public Mono<RoutingTable> loadPublished() {
        return headRepository.findCurrentVersion()
            .defaultIfEmpty(0L)
            .flatMap(version -> entryRepository.findByTableVersionOrderByRouteKey(version)
                .map(RowMapping::toEntry)
                .collectList()
                .map(entries -> RoutingTable.of(version, entries)))
            .onErrorMap(e -> !(e instanceof RoutingEngineException),
                        e -> new LedgerUnavailableException("routing table could not be read", e));
    }

    /**
     * Writes {@code next} and its events, then moves the head from {@code expectedVersion}.
     *
     * @throws RoutingEngineException (signalled) when another publish won the race
     */
    @Transactional
    public Mono<RoutingTable> publish(long expectedVersion, RoutingTable next, List<RoutingUpdateEvent> events) {
        List<RoutingEntryRow> entryRows = next.entries().stream()
            .map(e -> RowMapping.toRow(e, next.version()))
            .toList();
        List<RoutingUpdateEventRow> eventRows = events.stream()
            .map(e -> RowMapping.toRow(e, next.version()))
            .toList();

        return entryRepository.saveAll(entryRows).then()
            .then(Mono.defer(() -> eventRepository.saveAll(eventRows).then()))
            .then(Mono.defer(() -> headRepository.advance(expectedVersion, next.version())))
            .flatMap(updated -> updated == 1
                ? Mono.just(next)
                : Mono.<RoutingTable>error(conflict(expectedVersion, next.version(), null)))
            .onErrorMap(DataIntegrityViolationException.class,
                        e -> conflict(expectedVersion, next.version(), e))
            .onErrorMap(e -> !(e instanceof RoutingEngineException),
                        e -> new LedgerUnavailableException("routing table version " + next.version()
                                                            + " could not be written", e))
            .doOnSuccess(t -> log.info("ROUTING_TABLE_PUBLISHED version={} routes={} events={}",
                                       t.version(), t.size(), eventRows.size()));
    }

    /** Removes versions outside the retained window. Failures are logged and ignored. */
    public Mono<Void> prune(long publishedVersion) {
        long oldestRetained = publishedVersion - retainedVersions + 1;
        if (oldestRetained <= 1) {
            return Mono.empty();
        }
        return entryRepository.deleteVersionsBefore(oldestRetained)
            .doOnNext(deleted -> log.info("Routing table versions pruned. before={} rowsDeleted={}",
                                          oldestRetained, deleted))
            .then()
            .onErrorResume(e -> {
                log.warn("Routing table pruning failed (non-fatal). before={}", oldestRetained, e);
                return Mono.empty();
            });
    }

    private static RoutingEngineException conflict(long expected, long next, Throwable cause) {
        String message = "routing table version " + expected + " is no longer current; publish of version "
                         + next + " abandoned";
        return new RoutingEngineException(null, message, cause);
    }
}
