package com.flagship.agreement_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agreement_ledger.condition.Condition;
import com.flagship.agreement_ledger.escrow.Escrow;
import com.flagship.agreement_ledger.escrow.EscrowStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Response DTO for escrow details.
 */
@Value
@Builder
public class EscrowResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("sender")
    String sender;

    @JsonProperty("recipient")
    String recipient;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("conditions")
    List<Condition> conditions;

    @JsonProperty("status")
    EscrowStatus status;

    @JsonProperty("created_at")
    long createdAt;

    @JsonProperty("expires_at")
    long expiresAt;

    public static EscrowResponse from(Escrow escrow) {
        return EscrowResponse.builder()
            .id(escrow.getId())
            .sender(escrow.getSender().getAddress())
            .recipient(escrow.getRecipient().getAddress())
            .amount(escrow.getAmount())
            .conditions(escrow.getConditions())
            .status(escrow.getStatus())
            .createdAt(escrow.getCreatedAt())
            .expiresAt(escrow.getExpiresAt())
            .build();
    }
}
