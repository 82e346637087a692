package com.flagship.agreement_ledger.escrow;

import com.flagship.agreement_ledger.common.Amounts;
import com.flagship.agreement_ledger.common.LedgerError;
import com.flagship.agreement_ledger.common.LedgerException;
import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.condition.Condition;
import com.flagship.agreement_ledger.condition.ConditionEvaluator;
import com.flagship.agreement_ledger.host.InvocationContext;
import com.flagship.agreement_ledger.host.TransferInstruction;
import com.flagship.agreement_ledger.host.TransferPurpose;
import com.flagship.agreement_ledger.observability.LedgerMetrics;
import com.flagship.agreement_ledger.store.EntityKind;
import com.flagship.agreement_ledger.store.IdentifierAllocator;
import com.flagship.agreement_ledger.store.StoreKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Escrow state machine.
 *
 * Lifecycle:
 * <pre>
 * ACTIVE -> RELEASED   conditions met, not expired
 * ACTIVE -> REFUNDED   expired
 * </pre>
 *
 * Release and refund are complements in time: for a given ledger timestamp
 * at most one of them can succeed. Both are terminal; a settled escrow is
 * reported as ESCROW_NOT_FOUND to any further settlement attempt.
 *
 * Conditions are evaluated with short-circuit AND at the frozen ledger
 * timestamp. An escrow without conditions is releasable as soon as it is
 * created. Anyone may drive an escrow; the rules above decide the branch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowWorkflow {

    private static final String ESCROW_ID_MDC_KEY = "escrowId";

    private final IdentifierAllocator allocator;
    private final ConditionEvaluator conditionEvaluator;
    private final LedgerMetrics metrics;

    /**
     * Creates an ACTIVE escrow holding {@code amount} from the sender.
     *
     * @throws LedgerException INVALID_ADDRESS for an invalid party or condition validator,
     *         INVALID_AMOUNT for an invalid amount or an expiry not after the current ledger time,
     *         UNAUTHORIZED if the sender did not authorize the deposit
     */
    public EscrowResult create(InvocationContext context, Party sender, Party recipient, BigInteger amount,
                               List<Condition> conditions, long expiresAt) {
        // Validate parties, amount and every condition before touching any state
        context.getIdentity().validateAddress(sender);
        context.getIdentity().validateAddress(recipient);
        Amounts.requireValid(amount);
        List<Condition> attached = conditions == null ? List.of() : List.copyOf(conditions);
        for (Condition condition : attached) {
            if (condition.getType() == null) {
                throw new IllegalArgumentException("Condition type is required");
            }
            context.getIdentity().validateAddress(condition.getValidator());
        }
        context.getIdentity().requireAuthorized(sender);

        long now = context.getTimestamp();
        if (expiresAt <= now) {
            throw LedgerException.of(LedgerError.INVALID_AMOUNT,
                "Escrow expiry %d must be after the current ledger time %d", expiresAt, now);
        }

        // Allocate the id, take the deposit, then persist
        long id = allocator.next(context.getStore(), EntityKind.ESCROW);
        Escrow escrow = Escrow.active(id, sender, recipient, amount, attached, now, expiresAt);

        String deposit = context.getTransfers().transfer(
            new TransferInstruction(TransferPurpose.ESCROW_DEPOSIT, id, sender, null, amount));
        save(context, escrow);

        log.info("Escrow created: escrowId={}, amount={}, conditions={}, expiresAt={}, deposit={}",
            id, amount, attached.size(), expiresAt, deposit);
        return new EscrowResult(id, EscrowStatus.ACTIVE, null);
    }

    /**
     * Whether the escrow could be released now. Inactive or expired escrows
     * report false rather than an error.
     *
     * @throws LedgerException ESCROW_NOT_FOUND if there is no such escrow
     */
    public boolean conditionsMet(InvocationContext context, long escrowId) {
        Escrow escrow = get(context, escrowId);
        return isReleasable(context, escrow);
    }

    /**
     * @throws LedgerException ESCROW_NOT_FOUND if absent or no longer ACTIVE,
     *         ESCROW_EXPIRED if past expiry, CONDITIONS_NOT_MET if a condition is unmet
     */
    public EscrowResult release(InvocationContext context, long escrowId) {
        Escrow escrow = getActive(context, escrowId);
        if (escrow.isExpiredAt(context.getTimestamp())) {
            throw LedgerException.of(LedgerError.ESCROW_EXPIRED,
                "Escrow %d expired at %d", escrowId, escrow.getExpiresAt());
        }
        if (!conditionEvaluator.evaluateAll(escrow.getConditions(), context.getTimestamp())) {
            throw LedgerException.of(LedgerError.CONDITIONS_NOT_MET,
                "Escrow %d conditions are not met", escrowId);
        }
        return doRelease(context, escrow);
    }

    /**
     * Refund is valid only once the escrow has expired.
     *
     * @throws LedgerException ESCROW_NOT_FOUND if absent or no longer ACTIVE,
     *         CONDITIONS_NOT_MET if the escrow has not expired yet
     */
    public EscrowResult refund(InvocationContext context, long escrowId) {
        Escrow escrow = getActive(context, escrowId);
        if (!escrow.isExpiredAt(context.getTimestamp())) {
            throw LedgerException.of(LedgerError.CONDITIONS_NOT_MET,
                "Escrow %d cannot be refunded before expiry at %d", escrowId, escrow.getExpiresAt());
        }
        return doRefund(context, escrow);
    }

    /**
     * Drives an escrow without a caller-chosen branch: refund if expired,
     * release if releasable, otherwise leave it ACTIVE. Calling it again on
     * an ACTIVE escrow whose conditions are still unmet changes nothing.
     *
     * @throws LedgerException ESCROW_NOT_FOUND if absent or no longer ACTIVE
     */
    public EscrowResult process(InvocationContext context, long escrowId) {
        Escrow escrow = getActive(context, escrowId);
        // Expiry takes precedence over conditions
        if (escrow.isExpiredAt(context.getTimestamp())) {
            return doRefund(context, escrow);
        }
        if (conditionEvaluator.evaluateAll(escrow.getConditions(), context.getTimestamp())) {
            return doRelease(context, escrow);
        }
        log.debug("Escrow {} still pending", escrowId);
        return new EscrowResult(escrowId, EscrowStatus.ACTIVE, null);
    }

    /**
     * @throws LedgerException ESCROW_NOT_FOUND if there is no such escrow
     */
    public Escrow get(InvocationContext context, long escrowId) {
        return context.getStore().get(StoreKey.of(EntityKind.ESCROW, escrowId), Escrow.class)
            .orElseThrow(() -> LedgerException.of(LedgerError.ESCROW_NOT_FOUND, "Escrow not found: %d", escrowId));
    }

    private boolean isReleasable(InvocationContext context, Escrow escrow) {
        if (!escrow.isActive() || escrow.isExpiredAt(context.getTimestamp())) {
            return false;
        }
        return conditionEvaluator.evaluateAll(escrow.getConditions(), context.getTimestamp());
    }

    private Escrow getActive(InvocationContext context, long escrowId) {
        Escrow escrow = get(context, escrowId);
        if (!escrow.isActive()) {
            throw LedgerException.of(LedgerError.ESCROW_NOT_FOUND,
                "Escrow %d is %s, no active escrow with this id", escrowId, escrow.getStatus());
        }
        return escrow;
    }

    private EscrowResult doRelease(InvocationContext context, Escrow escrow) {
        String reference = context.getTransfers().transfer(new TransferInstruction(
            TransferPurpose.ESCROW_RELEASE, escrow.getId(), null, escrow.getRecipient(), escrow.getAmount()));
        Escrow released = escrow.release();
        save(context, released);
        logTransition(released, reference);
        return new EscrowResult(released.getId(), released.getStatus(), reference);
    }

    private EscrowResult doRefund(InvocationContext context, Escrow escrow) {
        String reference = context.getTransfers().transfer(new TransferInstruction(
            TransferPurpose.ESCROW_REFUND, escrow.getId(), null, escrow.getSender(), escrow.getAmount()));
        Escrow refunded = escrow.refund();
        save(context, refunded);
        logTransition(refunded, reference);
        return new EscrowResult(refunded.getId(), refunded.getStatus(), reference);
    }

    private void save(InvocationContext context, Escrow escrow) {
        context.getStore().set(StoreKey.of(EntityKind.ESCROW, escrow.getId()), escrow);
    }

    private void logTransition(Escrow escrow, String reference) {
        metrics.recordTransition("escrow", escrow.getStatus().name());
        MDC.put(ESCROW_ID_MDC_KEY, Long.toString(escrow.getId()));
        try {
            log.info("Escrow {}: amount={}, reference={}", escrow.getStatus(), escrow.getAmount(), reference);
        } finally {
            MDC.remove(ESCROW_ID_MDC_KEY);
        }
    }
}
