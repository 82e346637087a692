package com.flagship.agreement_ledger.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StagedLedgerStoreTest {

    private static final StoreKey COUNTER = StoreKey.counter(EntityKind.ESCROW);
    private static final StoreKey FLAG = StoreKey.singleton(RecordKind.REENTRANCY_FLAG);

    private InMemoryLedgerStore durable;
    private StagedLedgerStore staged;

    @BeforeEach
    void setUp() {
        durable = new InMemoryLedgerStore();
        staged = new StagedLedgerStore(durable);
    }

    @Test
    @DisplayName("Staged writes are visible to the invocation but not to the durable store")
    void testReadYourOwnWrites() {
        staged.set(COUNTER, 7L);

        assertEquals(7L, staged.get(COUNTER, Long.class).orElseThrow());
        assertTrue(staged.has(COUNTER));
        assertFalse(durable.has(COUNTER));
    }

    @Test
    @DisplayName("Commit applies every staged write, including removals")
    void testCommit() {
        durable.set(FLAG, Boolean.TRUE);
        staged.set(COUNTER, 3L);
        staged.remove(FLAG);

        assertFalse(staged.has(FLAG));
        staged.commit();

        assertEquals(3L, durable.get(COUNTER, Long.class).orElseThrow());
        assertFalse(durable.has(FLAG));
    }

    @Test
    @DisplayName("Discard drops every staged write")
    void testDiscard() {
        staged.set(COUNTER, 3L);
        staged.discard();

        assertFalse(durable.has(COUNTER));
        assertEquals(0, durable.size());
    }

    @Test
    @DisplayName("A closed staged store rejects further use")
    void testClosedStoreRejectsUse() {
        staged.commit();

        assertThrows(IllegalStateException.class, () -> staged.set(COUNTER, 1L));
        assertThrows(IllegalStateException.class, () -> staged.get(COUNTER, Long.class));
        assertThrows(IllegalStateException.class, staged::commit);
    }

    @Test
    @DisplayName("Set after remove restores the record")
    void testSetAfterRemove() {
        durable.set(COUNTER, 1L);
        staged.remove(COUNTER);
        staged.set(COUNTER, 2L);
        staged.commit();

        assertEquals(2L, durable.get(COUNTER, Long.class).orElseThrow());
    }
}
