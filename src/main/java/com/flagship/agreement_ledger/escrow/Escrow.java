package com.flagship.agreement_ledger.escrow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.condition.Condition;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.util.List;

/**
 * Conditional escrow.
 *
 * Invariants:
 * - expiresAt is strictly after createdAt
 * - release happens only while not expired, refund only once expired
 * - RELEASED and REFUNDED are terminal
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Escrow {
    long id;
    Party sender;
    Party recipient;
    BigInteger amount;
    @Singular
    List<Condition> conditions;
    EscrowStatus status;
    long createdAt;
    long expiresAt;

    public static Escrow active(long id, Party sender, Party recipient, BigInteger amount,
                                List<Condition> conditions, long createdAt, long expiresAt) {
        if (expiresAt <= createdAt) {
            throw new IllegalArgumentException(
                String.format("Escrow expiry %d must be after creation time %d", expiresAt, createdAt));
        }
        return Escrow.builder()
            .id(id)
            .sender(sender)
            .recipient(recipient)
            .amount(amount)
            .conditions(conditions)
            .status(EscrowStatus.ACTIVE)
            .createdAt(createdAt)
            .expiresAt(expiresAt)
            .build();
    }

    @JsonIgnore
    public boolean isActive() {
        return status == EscrowStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status == EscrowStatus.RELEASED || status == EscrowStatus.REFUNDED;
    }

    /**
     * Expired once the ledger time is strictly past the expiry timestamp.
     */
    public boolean isExpiredAt(long timestamp) {
        return timestamp > expiresAt;
    }

    /**
     * @throws IllegalStateException if the escrow is not ACTIVE
     */
    public Escrow release() {
        requireActive("release");
        return toBuilder().status(EscrowStatus.RELEASED).build();
    }

    /**
     * @throws IllegalStateException if the escrow is not ACTIVE
     */
    public Escrow refund() {
        requireActive("refund");
        return toBuilder().status(EscrowStatus.REFUNDED).build();
    }

    private void requireActive(String action) {
        if (!isActive()) {
            throw new IllegalStateException(
                String.format("Cannot %s escrow %d in %s status. Only ACTIVE escrows can change.", action, id, status));
        }
    }
}
