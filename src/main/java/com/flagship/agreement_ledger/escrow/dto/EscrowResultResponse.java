package com.flagship.agreement_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agreement_ledger.escrow.EscrowResult;
import com.flagship.agreement_ledger.escrow.EscrowStatus;
import lombok.Value;

@Value
public class EscrowResultResponse {

    @JsonProperty("escrow_id")
    long escrowId;

    @JsonProperty("status")
    EscrowStatus status;

    @JsonProperty("confirmation_reference")
    String confirmationReference;

    public static EscrowResultResponse from(EscrowResult result) {
        return new EscrowResultResponse(result.getEscrowId(), result.getStatus(), result.getConfirmationReference());
    }
}
