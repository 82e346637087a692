package com.flagship.agreement_ledger.store;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Write-staging view over a durable store, scoped to one invocation.
 *
 * Reads see the invocation's own writes first. Nothing reaches the durable
 * store until {@link #commit()}; {@link #discard()} drops every staged write.
 */
@Slf4j
public class StagedLedgerStore implements LedgerStore {

    private static final Object REMOVED = new Object();

    private final LedgerStore durable;
    private final Map<StoreKey, Object> staged = new LinkedHashMap<>();
    private boolean closed;

    public StagedLedgerStore(LedgerStore durable) {
        this.durable = Objects.requireNonNull(durable, "durable");
    }

    @Override
    public <T> Optional<T> get(StoreKey key, Class<T> type) {
        ensureOpen();
        Object value = staged.get(key);
        if (value == REMOVED) {
            return Optional.empty();
        }
        if (value != null) {
            return Optional.of(type.cast(value));
        }
        return durable.get(key, type);
    }

    @Override
    public void set(StoreKey key, Object record) {
        ensureOpen();
        staged.put(key, Objects.requireNonNull(record, "record"));
    }

    @Override
    public boolean has(StoreKey key) {
        ensureOpen();
        Object value = staged.get(key);
        if (value == REMOVED) {
            return false;
        }
        return value != null || durable.has(key);
    }

    @Override
    public void remove(StoreKey key) {
        ensureOpen();
        staged.put(key, REMOVED);
    }

    /**
     * Pushes the staged writes to the durable store as one batch.
     */
    public void commit() {
        ensureOpen();
        closed = true;
        if (staged.isEmpty()) {
            return;
        }
        List<StoreWrite> writes = new ArrayList<>(staged.size());
        staged.forEach((key, value) -> writes.add(
                value == REMOVED ? StoreWrite.removal(key) : StoreWrite.put(key, value)));
        durable.apply(writes);
        log.debug("Committed {} staged writes", writes.size());
    }

    public void discard() {
        closed = true;
        if (!staged.isEmpty()) {
            log.debug("Discarded {} staged writes", staged.size());
        }
        staged.clear();
    }

    public int pendingWrites() {
        return staged.size();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Staged store already committed or discarded");
        }
    }
}
