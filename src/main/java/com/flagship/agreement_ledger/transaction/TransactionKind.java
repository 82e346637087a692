package com.flagship.agreement_ledger.transaction;

public enum TransactionKind {
    BASIC,
    P2P
}
