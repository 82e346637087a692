package com.flagship.agreement_ledger.transaction;

import com.flagship.agreement_ledger.common.Party;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Direct value transfer between two parties.
 *
 * State changes are immutable: {@link #confirm()} returns a new record.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Transaction {
    long id;
    TransactionKind kind;
    Party sender;
    Party recipient;
    BigInteger amount;
    TransactionStatus status;
    long createdAt;
    String metadata;

    /**
     * Creates a new transaction in PENDING status.
     */
    public static Transaction pending(long id, TransactionKind kind, Party sender, Party recipient,
                                      BigInteger amount, long createdAt, String metadata) {
        return Transaction.builder()
            .id(id)
            .kind(kind)
            .sender(sender)
            .recipient(recipient)
            .amount(amount)
            .status(TransactionStatus.PENDING)
            .createdAt(createdAt)
            .metadata(metadata == null ? "" : metadata)
            .build();
    }

    /**
     * Transitions to CONFIRMED. Only valid from PENDING.
     *
     * @throws IllegalStateException if the transaction is not PENDING
     */
    public Transaction confirm() {
        if (status != TransactionStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot confirm transaction %d in %s status. Only PENDING transactions can be confirmed.",
                    id, status));
        }
        return toBuilder().status(TransactionStatus.CONFIRMED).build();
    }

    public boolean involves(Party party) {
        return sender.equals(party) || recipient.equals(party);
    }
}
