package com.flagship.agreement_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.util.List;

/**
 * Request DTO for creating an escrow. Expiry is in ledger seconds.
 */
@Value
@Builder
@Jacksonized
public class CreateEscrowRequest {

    @NotBlank(message = "Sender is required")
    @JsonProperty("sender")
    String sender;

    @NotBlank(message = "Recipient is required")
    @JsonProperty("recipient")
    String recipient;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;

    @Valid
    @Singular
    @JsonProperty("conditions")
    List<ConditionRequest> conditions;

    @NotNull(message = "Expiry is required")
    @JsonProperty("expires_at")
    Long expiresAt;
}
