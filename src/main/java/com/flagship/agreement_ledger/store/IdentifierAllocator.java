package com.flagship.agreement_ledger.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Issues identifiers per entity kind from counters kept in the ledger store.
 *
 * The first id of a kind is 1. The counter write is staged with the rest of
 * the invocation, so an operation rejected after drawing an id hands the same
 * id to the next caller. Durability of the counters is that of the store they
 * are written to.
 */
@Component
@Slf4j
public class IdentifierAllocator {

    public long next(LedgerStore store, EntityKind kind) {
        StoreKey counterKey = StoreKey.counter(kind);
        long current = store.get(counterKey, Long.class).orElse(0L);
        long next = Math.addExact(current, 1L);
        store.set(counterKey, next);
        log.debug("Allocated {} id {}", kind, next);
        return next;
    }

    /**
     * Highest id issued so far for the kind, or 0 if none.
     */
    public long current(LedgerStore store, EntityKind kind) {
        return store.get(StoreKey.counter(kind), Long.class).orElse(0L);
    }
}
