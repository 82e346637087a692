package com.flagship.agreement_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.condition.Condition;
import com.flagship.agreement_ledger.condition.ConditionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ConditionRequest {

    @NotNull(message = "Condition type is required")
    @JsonProperty("type")
    ConditionType type;

    @JsonProperty("parameters")
    String parameters;

    @NotBlank(message = "Validator is required")
    @JsonProperty("validator")
    String validator;

    public Condition toCondition() {
        return Condition.of(type, parameters == null ? "" : parameters, Party.of(validator));
    }
}
