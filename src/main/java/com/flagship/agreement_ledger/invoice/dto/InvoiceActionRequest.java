package com.flagship.agreement_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The acting party of an invoice transition: the creator when sending, the
 * client when approving or rejecting. The reason is read only on rejection.
 */
@Value
@Builder
@Jacksonized
public class InvoiceActionRequest {

    @NotBlank(message = "Party is required")
    @JsonProperty("party")
    String party;

    @JsonProperty("reason")
    String reason;
}
