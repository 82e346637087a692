package com.flagship.agreement_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agreement_ledger.invoice.InvoiceResult;
import com.flagship.agreement_ledger.invoice.InvoiceStatus;
import lombok.Value;

@Value
public class InvoiceResultResponse {

    @JsonProperty("invoice_id")
    long invoiceId;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("payment_reference")
    String paymentReference;

    public static InvoiceResultResponse from(InvoiceResult result) {
        return new InvoiceResultResponse(result.getInvoiceId(), result.getStatus(), result.getPaymentReference());
    }
}
