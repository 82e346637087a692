package com.flagship.agreement_ledger.transaction;

/**
 * Transaction status.
 *
 * A transaction is written PENDING and confirmed within the same invocation,
 * so callers only ever observe CONFIRMED.
 */
public enum TransactionStatus {
    /**
     * Recorded, transfer not yet executed.
     */
    PENDING,

    /**
     * Transfer executed. Terminal.
     */
    CONFIRMED,

    /**
     * Reserved for transfers rejected by the host. Not produced by the engine.
     */
    FAILED,

    /**
     * Reserved for transfers withdrawn before execution. Not produced by the engine.
     */
    CANCELLED
}
