package com.routecast.performance.service;

import com.routecast.common.ledger.LedgerSnapshot;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.performance.model.RowMapping;
import com.routecast.performance.repository.PerformanceRecordRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Transactional boundary of the persisted Ledger.
 *
 * <p>A batch is upserted in one transaction, and the snapshot read by an update cycle
 * runs in a read-only REPEATABLE READ transaction, so a cycle never observes half of
 * a batch that is still being written.
 */
@Component
public class LedgerWriter {

    private final PerformanceRecordRepository repository;

    public LedgerWriter(PerformanceRecordRepository repository) {
        this.repository = repository;
    }

    /** @return rows inserted or updated */
    @Transactional
    public Mono<Integer> upsertAll(List<PerformanceRecord> records) {
        return Flux.fromIterable(records)
            .concatMap(r -> repository.upsertRecord(
                r.route().routeKey(), r.period().week(), r.period().year(), r.modelId(),
                r.forecastValue(), r.actualValue(), r.errorPct(), r.absErrorPct(),
                RowMapping.toLocal(r.recordedAt())))
            .reduce(0, Integer::sum);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Mono<LedgerSnapshot> snapshot() {
        return repository.findAll()
            .map(RowMapping::toRecord)
            .collectList()
            .map(LedgerSnapshot::of);
    }
}
