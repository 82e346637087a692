package com.flagship.agreement_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A validator's approval of a manual-approval condition, identified by the
 * condition's parameter blob.
 */
@Value
@Builder
@Jacksonized
public class ApprovalRequest {

    @NotBlank(message = "Validator is required")
    @JsonProperty("validator")
    String validator;

    @JsonProperty("parameters")
    String parameters;
}
