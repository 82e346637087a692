package com.flagship.agreement_ledger.transaction;

import lombok.Value;

@Value
public class TransactionResult {
    long transactionId;
    TransactionStatus status;
    String confirmationReference;
}
