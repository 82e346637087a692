package com.flagship.agreement_ledger.store;

import com.flagship.agreement_ledger.common.Party;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Composite key of the ledger store: a record kind plus an optional qualifier
 * (entity id or party address). Singleton kinds have no qualifier.
 */
@Getter
@EqualsAndHashCode
public final class StoreKey {

    private final RecordKind kind;
    private final String qualifier;

    private StoreKey(RecordKind kind, String qualifier) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.qualifier = qualifier;
    }

    public static StoreKey singleton(RecordKind kind) {
        if (!kind.isSingleton()) {
            throw new IllegalArgumentException(kind + " is not a singleton record kind");
        }
        return new StoreKey(kind, null);
    }

    public static StoreKey of(RecordKind kind, long id) {
        if (kind.isSingleton()) {
            throw new IllegalArgumentException(kind + " is a singleton record kind");
        }
        return new StoreKey(kind, Long.toString(id));
    }

    public static StoreKey of(EntityKind kind, long id) {
        return of(kind.getRecordKind(), id);
    }

    public static StoreKey forParty(RecordKind kind, Party party) {
        if (kind.isSingleton()) {
            throw new IllegalArgumentException(kind + " is a singleton record kind");
        }
        return new StoreKey(kind, party.getAddress());
    }

    public static StoreKey counter(EntityKind kind) {
        return singleton(kind.getCounterKind());
    }

    /**
     * Flat representation, e.g. {@code escrow:12} or {@code tx_count}.
     */
    public String asString() {
        return qualifier == null ? kind.getTag() : kind.getTag() + ":" + qualifier;
    }

    @Override
    public String toString() {
        return asString();
    }
}
