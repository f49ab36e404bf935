package com.routecast.common.ledger;

import com.routecast.common.model.PerformanceRecord;
import com.routecast.common.model.Route;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory {@link LedgerStore}.
 *
 * <p>Writers share the read side of a {@link ReadWriteLock} so per-route workers can
 * upsert concurrently; {@link #snapshot()} takes the write side so it never sees a
 * half-applied batch.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<Route, Map<PerformanceRecord.Key, PerformanceRecord>> byRoute = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void upsert(PerformanceRecord record) {
        lock.readLock().lock();
        try {
            byRoute.computeIfAbsent(record.route(), r -> new ConcurrentHashMap<>())
                   .put(record.key(), record);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void upsertAll(Collection<PerformanceRecord> records) {
        lock.readLock().lock();
        try {
            for (PerformanceRecord record : records) {
                byRoute.computeIfAbsent(record.route(), r -> new ConcurrentHashMap<>())
                       .put(record.key(), record);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public LedgerSnapshot snapshot() {
        lock.writeLock().lock();
        try {
            List<PerformanceRecord> copy = new ArrayList<>();
            byRoute.values().forEach(m -> copy.addAll(m.values()));
            return LedgerSnapshot.of(copy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Set<Route> routes() {
        return Set.copyOf(byRoute.keySet());
    }

    @Override
    public List<PerformanceRecord> recordsFor(Route route) {
        Map<PerformanceRecord.Key, PerformanceRecord> records = byRoute.get(route);
        return records == null ? List.of() : List.copyOf(records.values());
    }

    @Override
    public int size() {
        return byRoute.values().stream().mapToInt(Map::size).sum();
    }
}
