package com.flagship.agreement_ledger.host;

public enum TransferPurpose {
    TRANSACTION,
    P2P,
    ESCROW_DEPOSIT,
    ESCROW_RELEASE,
    ESCROW_REFUND,
    INVOICE_PAYMENT
}
