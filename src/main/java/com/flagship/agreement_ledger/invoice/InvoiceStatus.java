package com.flagship.agreement_ledger.invoice;

/**
 * Invoice lifecycle.
 *
 * DRAFT → SENT → APPROVED → EXECUTED
 * DRAFT | SENT → REJECTED
 * SENT | APPROVED → EXPIRED once the due date has passed
 */
public enum InvoiceStatus {
    DRAFT,
    SENT,
    APPROVED,
    EXECUTED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this == EXECUTED || this == REJECTED || this == EXPIRED;
    }

    /**
     * Statuses from which the client may still approve or reject.
     */
    public boolean isAwaitingClient() {
        return this == DRAFT || this == SENT;
    }
}
