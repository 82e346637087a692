package com.flagship.agreement_ledger.invoice;

import com.flagship.agreement_ledger.common.Amounts;
import com.flagship.agreement_ledger.common.LedgerError;
import com.flagship.agreement_ledger.common.LedgerException;
import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.host.InvocationContext;
import com.flagship.agreement_ledger.host.TransferInstruction;
import com.flagship.agreement_ledger.host.TransferPurpose;
import com.flagship.agreement_ledger.observability.LedgerMetrics;
import com.flagship.agreement_ledger.store.EntityKind;
import com.flagship.agreement_ledger.store.IdentifierAllocator;
import com.flagship.agreement_ledger.store.StoreKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Invoice state machine.
 *
 * Lifecycle:
 * <pre>
 * DRAFT -> SENT -> APPROVED -> EXECUTED
 *   |        |         |
 *   +--------+-> REJECTED
 *            +---------+-> EXPIRED
 * </pre>
 *
 * Expiry wins over approval: an approve or execute attempted after the due
 * date persists the invoice as EXPIRED and still fails with INVOICE_EXPIRED.
 * That error is raised as a state correction, so the host commits the
 * EXPIRED record while discarding the writes of every other rejection.
 *
 * Every method runs inside a host invocation and reads the frozen ledger
 * timestamp from the context, never from a wall clock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceWorkflow {

    private final IdentifierAllocator allocator;
    private final LedgerMetrics metrics;

    /**
     * @throws LedgerException INVALID_ADDRESS, INVALID_AMOUNT (also for a due date
     *         not after the current ledger time), UNAUTHORIZED if the creator did not sign
     */
    public InvoiceResult create(InvocationContext context, Party creator, Party client, BigInteger amount,
                                String description, long dueDate) {
        // Validate inputs before touching any state
        context.getIdentity().validateAddress(creator);
        context.getIdentity().validateAddress(client);
        Amounts.requireValid(amount);
        context.getIdentity().requireAuthorized(creator);

        long now = context.getTimestamp();
        if (dueDate <= now) {
            throw LedgerException.of(LedgerError.INVALID_AMOUNT,
                "Invoice due date %d must be after the current ledger time %d", dueDate, now);
        }

        // Allocate the id and persist the draft
        long id = allocator.next(context.getStore(), EntityKind.INVOICE);
        Invoice invoice = Invoice.draft(id, creator, client, amount, description, now, dueDate);
        save(context, invoice);

        log.info("Invoice created: invoiceId={}, amount={}, dueDate={}", id, amount, dueDate);
        return new InvoiceResult(id, InvoiceStatus.DRAFT, null);
    }

    /**
     * @throws LedgerException INVOICE_NOT_FOUND, UNAUTHORIZED if the caller is not
     *         the creator or the invoice is no longer a draft
     */
    public InvoiceResult markSent(InvocationContext context, long invoiceId, Party creator) {
        Invoice invoice = get(context, invoiceId);
        context.getIdentity().requireAuthorized(creator);
        if (!invoice.getCreator().equals(creator)) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED,
                "Only the creator can send invoice %d", invoiceId);
        }
        if (invoice.getStatus() != InvoiceStatus.DRAFT) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED,
                "Invoice %d is %s, only drafts can be sent", invoiceId, invoice.getStatus());
        }
        return transition(context, invoice.markSent(), null);
    }

    /**
     * @throws LedgerException INVOICE_NOT_FOUND, UNAUTHORIZED for a wrong or unsigned client,
     *         INVOICE_ALREADY_APPROVED if the invoice left DRAFT/SENT,
     *         INVOICE_EXPIRED if the due date has passed (the invoice is persisted as EXPIRED)
     */
    public InvoiceResult approve(InvocationContext context, long invoiceId, Party client) {
        Invoice invoice = get(context, invoiceId);
        context.getIdentity().requireAuthorized(client);
        if (!invoice.getClient().equals(client)) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED,
                "Only the client can approve invoice %d", invoiceId);
        }
        if (!invoice.getStatus().isAwaitingClient()) {
            throw LedgerException.of(LedgerError.INVOICE_ALREADY_APPROVED,
                "Invoice %d is already %s", invoiceId, invoice.getStatus());
        }
        // Expiry is checked last so the status error takes precedence
        if (invoice.isPastDue(context.getTimestamp())) {
            expireAndFail(context, invoice);
        }
        return transition(context, invoice.approve(context.getTimestamp()), null);
    }

    /**
     * Pays the creator from the client.
     *
     * @throws LedgerException INVOICE_NOT_FOUND, UNAUTHORIZED if not APPROVED or the
     *         client did not authorize the payment, INVOICE_EXPIRED if the due date has
     *         passed (the invoice is persisted as EXPIRED)
     */
    public InvoiceResult execute(InvocationContext context, long invoiceId) {
        Invoice invoice = get(context, invoiceId);
        if (invoice.getStatus() != InvoiceStatus.APPROVED) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED,
                "Invoice %d is %s, only approved invoices can be executed", invoiceId, invoice.getStatus());
        }
        if (invoice.isPastDue(context.getTimestamp())) {
            expireAndFail(context, invoice);
        }
        context.getIdentity().requireAuthorized(invoice.getClient());

        // Move the funds, then record the outcome
        String reference = context.getTransfers().transfer(new TransferInstruction(
            TransferPurpose.INVOICE_PAYMENT, invoiceId, invoice.getClient(), invoice.getCreator(), invoice.getAmount()));
        return transition(context, invoice.execute(), reference);
    }

    /**
     * The reason is stored for audit only.
     *
     * @throws LedgerException INVOICE_NOT_FOUND, UNAUTHORIZED for a wrong client or
     *         an invoice that already left DRAFT/SENT
     */
    public InvoiceResult reject(InvocationContext context, long invoiceId, Party client, String reason) {
        Invoice invoice = get(context, invoiceId);
        context.getIdentity().requireAuthorized(client);
        if (!invoice.getClient().equals(client)) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED,
                "Only the client can reject invoice %d", invoiceId);
        }
        if (!invoice.getStatus().isAwaitingClient()) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED,
                "Invoice %d is %s and can no longer be rejected", invoiceId, invoice.getStatus());
        }
        log.info("Invoice {} rejected by client: reason={}", invoiceId, reason);
        return transition(context, invoice.reject(reason), null);
    }

    /**
     * Expires a SENT or APPROVED invoice whose due date has passed; otherwise
     * reports the current status. Safe to repeat.
     *
     * @throws LedgerException INVOICE_NOT_FOUND
     */
    public InvoiceStatus checkExpiration(InvocationContext context, long invoiceId) {
        Invoice invoice = get(context, invoiceId);
        boolean expirable = invoice.getStatus() == InvoiceStatus.SENT
            || invoice.getStatus() == InvoiceStatus.APPROVED;
        if (expirable && invoice.isPastDue(context.getTimestamp())) {
            return transition(context, invoice.expire(), null).getStatus();
        }
        return invoice.getStatus();
    }

    /**
     * @throws LedgerException INVOICE_NOT_FOUND
     */
    public Invoice get(InvocationContext context, long invoiceId) {
        return context.getStore().get(StoreKey.of(EntityKind.INVOICE, invoiceId), Invoice.class)
            .orElseThrow(() -> LedgerException.of(LedgerError.INVOICE_NOT_FOUND, "Invoice not found: %d", invoiceId));
    }

    private void expireAndFail(InvocationContext context, Invoice invoice) {
        transition(context, invoice.expire(), null);
        throw LedgerException.correction(LedgerError.INVOICE_EXPIRED,
            "Invoice %d passed its due date %d", invoice.getId(), invoice.getDueDate());
    }

    private void save(InvocationContext context, Invoice invoice) {
        context.getStore().set(StoreKey.of(EntityKind.INVOICE, invoice.getId()), invoice);
    }

    private InvoiceResult transition(InvocationContext context, Invoice updated, String reference) {
        save(context, updated);
        metrics.recordTransition("invoice", updated.getStatus().name());
        log.info("Invoice {}: invoiceId={}", updated.getStatus(), updated.getId());
        return new InvoiceResult(updated.getId(), updated.getStatus(), reference);
    }
}
