package com.flagship.agreement_ledger.invoice;

import com.flagship.agreement_ledger.common.Party;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Invoice issued by a creator to a client.
 *
 * Invariants:
 * - approvedAt is set only while the invoice is APPROVED or EXECUTED
 * - EXECUTED, REJECTED and EXPIRED are terminal
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Invoice {
    long id;
    Party creator;
    Party client;
    BigInteger amount;
    String description;
    InvoiceStatus status;
    long createdAt;
    long dueDate;
    Long approvedAt;
    String rejectionReason;

    public static Invoice draft(long id, Party creator, Party client, BigInteger amount,
                                String description, long createdAt, long dueDate) {
        return Invoice.builder()
            .id(id)
            .creator(creator)
            .client(client)
            .amount(amount)
            .description(description == null ? "" : description)
            .status(InvoiceStatus.DRAFT)
            .createdAt(createdAt)
            .dueDate(dueDate)
            .build();
    }

    public boolean isPastDue(long timestamp) {
        return timestamp > dueDate;
    }

    public Invoice markSent() {
        requireStatus("send", InvoiceStatus.DRAFT);
        return toBuilder().status(InvoiceStatus.SENT).build();
    }

    public Invoice approve(long timestamp) {
        if (!status.isAwaitingClient()) {
            throw illegalTransition("approve");
        }
        return toBuilder().status(InvoiceStatus.APPROVED).approvedAt(timestamp).build();
    }

    public Invoice execute() {
        requireStatus("execute", InvoiceStatus.APPROVED);
        return toBuilder().status(InvoiceStatus.EXECUTED).build();
    }

    public Invoice reject(String reason) {
        if (!status.isAwaitingClient()) {
            throw illegalTransition("reject");
        }
        return toBuilder().status(InvoiceStatus.REJECTED).rejectionReason(reason).build();
    }

    /**
     * Expiry supersedes any approval, so the approval timestamp is cleared.
     */
    public Invoice expire() {
        if (status.isTerminal()) {
            throw illegalTransition("expire");
        }
        return toBuilder().status(InvoiceStatus.EXPIRED).approvedAt(null).build();
    }

    private void requireStatus(String action, InvoiceStatus expected) {
        if (status != expected) {
            throw illegalTransition(action);
        }
    }

    private IllegalStateException illegalTransition(String action) {
        return new IllegalStateException(
            String.format("Cannot %s invoice %d in %s status", action, id, status));
    }
}
