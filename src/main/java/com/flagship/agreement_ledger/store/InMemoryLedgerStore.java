package com.flagship.agreement_ledger.store;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime store. Records are immutable value objects, so they are
 * kept by reference.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<StoreKey, Object> records = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> get(StoreKey key, Class<T> type) {
        return Optional.ofNullable(records.get(key)).map(type::cast);
    }

    @Override
    public void set(StoreKey key, Object record) {
        records.put(key, Objects.requireNonNull(record, "record"));
    }

    @Override
    public boolean has(StoreKey key) {
        return records.containsKey(key);
    }

    @Override
    public void remove(StoreKey key) {
        records.remove(key);
    }

    @Override
    public synchronized void apply(List<StoreWrite> writes) {
        LedgerStore.super.apply(writes);
    }

    public int size() {
        return records.size();
    }
}
