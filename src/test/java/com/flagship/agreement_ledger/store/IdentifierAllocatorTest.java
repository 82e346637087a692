package com.flagship.agreement_ledger.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierAllocatorTest {

    private IdentifierAllocator allocator;
    private InMemoryLedgerStore store;

    @BeforeEach
    void setUp() {
        allocator = new IdentifierAllocator();
        store = new InMemoryLedgerStore();
    }

    @Test
    @DisplayName("First id of a kind is 1 and ids strictly increase")
    void testIdsStrictlyIncrease() {
        long previous = 0;
        for (int i = 0; i < 100; i++) {
            long next = allocator.next(store, EntityKind.ESCROW);
            assertTrue(next > previous, "ids must strictly increase");
            previous = next;
        }
        assertEquals(100, previous);
        assertEquals(100, allocator.current(store, EntityKind.ESCROW));
    }

    @Test
    @DisplayName("Each entity kind has its own counter")
    void testCountersAreIndependent() {
        assertEquals(1, allocator.next(store, EntityKind.TRANSACTION));
        assertEquals(2, allocator.next(store, EntityKind.TRANSACTION));
        assertEquals(1, allocator.next(store, EntityKind.INVOICE));
        assertEquals(0, allocator.current(store, EntityKind.ESCROW));
    }

    @Test
    @DisplayName("Counter survives through the store, not the allocator instance")
    void testCounterLivesInStore() {
        allocator.next(store, EntityKind.TRANSACTION);
        allocator.next(store, EntityKind.TRANSACTION);

        assertEquals(3, new IdentifierAllocator().next(store, EntityKind.TRANSACTION));
    }
}
