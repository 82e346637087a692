package com.flagship.agreement_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class InitializeRequest {

    @NotBlank(message = "Admin is required")
    @JsonProperty("admin")
    String admin;
}
