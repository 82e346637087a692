package com.flagship.agreement_ledger.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PartyIndexTest {

    @Test
    @DisplayName("Append keeps ids in ascending order and refuses going backwards")
    void testAppend() {
        PartyIndex index = PartyIndex.empty().append(1).append(4).append(9);

        assertEquals(List.of(1L, 4L, 9L), index.getIds());
        assertThrows(IllegalStateException.class, () -> index.append(9));
        assertThrows(IllegalStateException.class, () -> index.append(2));
    }

    @Test
    @DisplayName("Paging past the end yields an empty page")
    void testPage() {
        PartyIndex index = PartyIndex.empty().append(1).append(2).append(3);

        assertEquals(List.of(2L, 3L), index.page(1, 10));
        assertEquals(List.of(1L), index.page(0, 1));
        assertTrue(index.page(3, 5).isEmpty());
    }
}
