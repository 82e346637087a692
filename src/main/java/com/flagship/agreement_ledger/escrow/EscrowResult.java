package com.flagship.agreement_ledger.escrow;

import lombok.Value;

/**
 * Outcome of an escrow operation. The confirmation reference is present only
 * when funds left custody (release or refund).
 */
@Value
public class EscrowResult {
    long escrowId;
    EscrowStatus status;
    String confirmationReference;
}
