package com.routecast.common.ledger;

import com.routecast.common.exception.LedgerUnavailableException;
import com.routecast.common.model.EvaluationBatch;
import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Period;
import com.routecast.common.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * De-duplicated, upsert-only store of forecast-vs-actual outcomes.
 *
 * <p>Recording the same {@code (route, period, model)} twice leaves exactly one
 * record. Storage failures surface as {@link LedgerUnavailableException}.
 */
public class PerformanceLedger {

    private static final Logger log = LoggerFactory.getLogger(PerformanceLedger.class);

    private final LedgerStore store;
    private final BatchEvaluator evaluator;

    public PerformanceLedger(LedgerStore store, BatchEvaluator evaluator) {
        this.store     = store;
        this.evaluator = evaluator;
    }

    public PerformanceRecord record(Route route, Period period, String modelId,
                                    double forecastValue, double actualValue) {
        PerformanceRecord record = evaluator.toRecord(route, period, modelId, forecastValue, actualValue);
        write(() -> store.upsert(record));
        return record;
    }

    /**
     * Records a full evaluation batch. Safe to invoke again with the same batch.
     */
    public LedgerBatch recordBatch(EvaluationBatch batch) {
        LedgerBatch prepared = evaluator.evaluate(batch);
        write(() -> store.upsertAll(prepared.records()));
        log.info("Evaluation batch recorded. period={} records={} ledgerSize={}",
                 prepared.period(), prepared.records().size(), store.size());
        return prepared;
    }

    public LedgerSnapshot snapshot() {
        try {
            return store.snapshot();
        } catch (RuntimeException e) {
            throw new LedgerUnavailableException("Ledger snapshot failed", e);
        }
    }

    private void write(Runnable operation) {
        try {
            operation.run();
        } catch (RuntimeException e) {
            log.error("Ledger write failed", e);
            throw new LedgerUnavailableException("Ledger write failed", e);
        }
    }
}
