package com.flagship.agreement_ledger.store;

/**
 * The three agreement kinds that receive identifiers from the allocator.
 */
public enum EntityKind {
    TRANSACTION(RecordKind.TRANSACTION, RecordKind.TRANSACTION_COUNTER),
    ESCROW(RecordKind.ESCROW, RecordKind.ESCROW_COUNTER),
    INVOICE(RecordKind.INVOICE, RecordKind.INVOICE_COUNTER);

    private final RecordKind recordKind;
    private final RecordKind counterKind;

    EntityKind(RecordKind recordKind, RecordKind counterKind) {
        this.recordKind = recordKind;
        this.counterKind = counterKind;
    }

    public RecordKind getRecordKind() {
        return recordKind;
    }

    public RecordKind getCounterKind() {
        return counterKind;
    }
}
