package com.flagship.agreement_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Request DTO for creating an invoice. The due date is in ledger seconds.
 */
@Value
@Builder
@Jacksonized
public class CreateInvoiceRequest {

    @NotBlank(message = "Creator is required")
    @JsonProperty("creator")
    String creator;

    @NotBlank(message = "Client is required")
    @JsonProperty("client")
    String client;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Due date is required")
    @JsonProperty("due_date")
    Long dueDate;
}
