package com.flagship.agreement_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class LedgerInfoResponse {

    @JsonProperty("version")
    int version;

    @JsonProperty("admin")
    String admin;
}
