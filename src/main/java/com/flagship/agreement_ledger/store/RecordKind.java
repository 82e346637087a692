package com.flagship.agreement_ledger.store;

/**
 * Tag for every kind of entry in the ledger store.
 *
 * Singleton kinds have exactly one entry; the others are qualified by an
 * entity id or a party reference.
 */
public enum RecordKind {
    ADMIN("admin", true),
    TRANSACTION_COUNTER("tx_count", true),
    ESCROW_COUNTER("esc_count", true),
    INVOICE_COUNTER("inv_count", true),
    REENTRANCY_FLAG("reentry", true),
    TRANSACTION("transaction", false),
    ESCROW("escrow", false),
    INVOICE("invoice", false),
    PARTY_TRANSACTIONS("party_tx", false);

    private final String tag;
    private final boolean singleton;

    RecordKind(String tag, boolean singleton) {
        this.tag = tag;
        this.singleton = singleton;
    }

    public String getTag() {
        return tag;
    }

    public boolean isSingleton() {
        return singleton;
    }
}
