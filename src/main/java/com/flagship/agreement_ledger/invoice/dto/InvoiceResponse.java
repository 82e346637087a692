package com.flagship.agreement_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agreement_ledger.invoice.Invoice;
import com.flagship.agreement_ledger.invoice.InvoiceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Response DTO for invoice details.
 */
@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("creator")
    String creator;

    @JsonProperty("client")
    String client;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("created_at")
    long createdAt;

    @JsonProperty("due_date")
    long dueDate;

    @JsonProperty("approved_at")
    Long approvedAt;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    public static InvoiceResponse from(Invoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .creator(invoice.getCreator().getAddress())
            .client(invoice.getClient().getAddress())
            .amount(invoice.getAmount())
            .description(invoice.getDescription())
            .status(invoice.getStatus())
            .createdAt(invoice.getCreatedAt())
            .dueDate(invoice.getDueDate())
            .approvedAt(invoice.getApprovedAt())
            .rejectionReason(invoice.getRejectionReason())
            .build();
    }
}
