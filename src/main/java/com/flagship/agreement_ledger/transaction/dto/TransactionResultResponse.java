package com.flagship.agreement_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agreement_ledger.transaction.TransactionResult;
import com.flagship.agreement_ledger.transaction.TransactionStatus;
import lombok.Value;

@Value
public class TransactionResultResponse {

    @JsonProperty("transaction_id")
    long transactionId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("confirmation_reference")
    String confirmationReference;

    public static TransactionResultResponse from(TransactionResult result) {
        return new TransactionResultResponse(
            result.getTransactionId(), result.getStatus(), result.getConfirmationReference());
    }
}
