package com.flagship.agreement_ledger.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Secondary index entry: ids of the records a party takes part in, in
 * ascending order.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PartyIndex {

    @Singular
    List<Long> ids;

    public static PartyIndex empty() {
        return PartyIndex.builder().build();
    }

    /**
     * Returns an index with {@code id} appended. Ids are allocated in
     * increasing order, so appending keeps the list sorted.
     */
    public PartyIndex append(long id) {
        if (!ids.isEmpty() && ids.get(ids.size() - 1) >= id) {
            throw new IllegalStateException(
                String.format("Index ids must increase: last=%d, new=%d", ids.get(ids.size() - 1), id));
        }
        List<Long> next = new ArrayList<>(ids);
        next.add(id);
        return new PartyIndex(List.copyOf(next));
    }

    public List<Long> page(int offset, int limit) {
        if (offset >= ids.size()) {
            return List.of();
        }
        return ids.subList(offset, Math.min(ids.size(), offset + limit));
    }
}
