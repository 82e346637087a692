package com.flagship.agreement_ledger.common;

/**
 * Error kinds reported by ledger operations.
 *
 * Codes are stable and part of the external contract: clients match on the
 * numeric code, never on the message.
 */
public enum LedgerError {
    INVALID_ADDRESS(2),
    UNAUTHORIZED(3),
    INVALID_AMOUNT(4),
    TRANSACTION_NOT_FOUND(5),
    ESCROW_NOT_FOUND(6),
    CONDITIONS_NOT_MET(7),
    ESCROW_EXPIRED(8),
    INVOICE_NOT_FOUND(9),
    INVOICE_ALREADY_APPROVED(10),
    INVOICE_EXPIRED(11),
    INVALID_SIGNATURE(12),
    REENTRANCY_DETECTED(13);

    private final int code;

    LedgerError(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isNotFound() {
        return this == TRANSACTION_NOT_FOUND || this == ESCROW_NOT_FOUND || this == INVOICE_NOT_FOUND;
    }
}
