package com.flagship.agreement_ledger.escrow;

/**
 * Escrow status. Only ACTIVE escrows can change; the other states are terminal.
 */
public enum EscrowStatus {
    /**
     * Funds held, waiting for conditions or expiry.
     */
    ACTIVE,

    /**
     * Conditions met before expiry, funds paid to the recipient. Terminal.
     */
    RELEASED,

    /**
     * Expired, funds returned to the sender. Terminal.
     */
    REFUNDED
}
