package com.flagship.agreement_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Request body for basic and P2P transactions. Only the shape is validated
 * here; address and amount rules are the ledger's.
 */
@Value
@Builder
@Jacksonized
public class ExecuteTransactionRequest {

    @NotBlank(message = "Sender is required")
    @JsonProperty("sender")
    String sender;

    @NotBlank(message = "Recipient is required")
    @JsonProperty("recipient")
    String recipient;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("metadata")
    String metadata;
}
