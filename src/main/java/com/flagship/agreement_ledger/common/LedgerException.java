package com.flagship.agreement_ledger.common;

/**
 * Semantic failure of a ledger operation.
 *
 * Thrown for every rejection the engine reports to its caller. By default the
 * host discards every write staged by the failed invocation, so a rejected
 * operation leaves no trace. A state correction (for example an invoice found
 * past its due date and moved to EXPIRED) is the exception: its writes are
 * committed and the error is still reported.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;
    private final boolean stateCorrection;

    public LedgerException(LedgerError error, String message) {
        this(error, message, false);
    }

    private LedgerException(LedgerError error, String message, boolean stateCorrection) {
        super(message);
        this.error = error;
        this.stateCorrection = stateCorrection;
    }

    public LedgerError getError() {
        return error;
    }

    /**
     * Whether the writes staged before this error must be committed.
     */
    public boolean isStateCorrection() {
        return stateCorrection;
    }

    public static LedgerException of(LedgerError error, String format, Object... args) {
        return new LedgerException(error, String.format(format, args), false);
    }

    /**
     * Error raised after the operation has deliberately corrected state that
     * must persist.
     */
    public static LedgerException correction(LedgerError error, String format, Object... args) {
        return new LedgerException(error, String.format(format, args), true);
    }
}
