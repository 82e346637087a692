package com.flagship.agreement_ledger.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable key-value store backing the ledger.
 *
 * All mutations are whole-record overwrites. The store knows nothing about
 * relationships between record kinds.
 */
public interface LedgerStore {

    <T> Optional<T> get(StoreKey key, Class<T> type);

    void set(StoreKey key, Object record);

    boolean has(StoreKey key);

    void remove(StoreKey key);

    /**
     * Applies a batch of writes in order. Backends that support it apply the
     * batch atomically.
     */
    default void apply(List<StoreWrite> writes) {
        for (StoreWrite write : writes) {
            if (write.isRemoval()) {
                remove(write.getKey());
            } else {
                set(write.getKey(), write.getRecord());
            }
        }
    }
}
