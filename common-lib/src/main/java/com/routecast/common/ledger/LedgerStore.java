package com.routecast.common.ledger;

import com.routecast.common.model.PerformanceRecord;

import java.util.Collection;

/**
 * Mutable ledger storage. Upserts are atomic per {@link PerformanceRecord.Key};
 * a second write with the same key replaces the first.
 */
public interface LedgerStore extends LedgerView {

    void upsert(PerformanceRecord record);

    default void upsertAll(Collection<PerformanceRecord> records) {
        records.forEach(this::upsert);
    }

    /**
     * @return a consistent, immutable copy that never observes later or partial writes
     */
    LedgerSnapshot snapshot();

    int size();
}
