package com.flagship.agreement_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agreement_ledger.transaction.Transaction;
import com.flagship.agreement_ledger.transaction.TransactionKind;
import com.flagship.agreement_ledger.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Response DTO for a stored transaction.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("sender")
    String sender;

    @JsonProperty("recipient")
    String recipient;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("created_at")
    long createdAt;

    @JsonProperty("metadata")
    String metadata;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .kind(transaction.getKind())
            .sender(transaction.getSender().getAddress())
            .recipient(transaction.getRecipient().getAddress())
            .amount(transaction.getAmount())
            .status(transaction.getStatus())
            .createdAt(transaction.getCreatedAt())
            .metadata(transaction.getMetadata())
            .build();
    }
}
