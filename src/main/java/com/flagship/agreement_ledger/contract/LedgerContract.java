package com.flagship.agreement_ledger.contract;

import com.flagship.agreement_ledger.common.LedgerError;
import com.flagship.agreement_ledger.common.LedgerException;
import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.condition.ApprovalRegistry;
import com.flagship.agreement_ledger.condition.Condition;
import com.flagship.agreement_ledger.escrow.Escrow;
import com.flagship.agreement_ledger.escrow.EscrowResult;
import com.flagship.agreement_ledger.escrow.EscrowWorkflow;
import com.flagship.agreement_ledger.host.LedgerHost;
import com.flagship.agreement_ledger.invoice.Invoice;
import com.flagship.agreement_ledger.invoice.InvoiceResult;
import com.flagship.agreement_ledger.invoice.InvoiceStatus;
import com.flagship.agreement_ledger.invoice.InvoiceWorkflow;
import com.flagship.agreement_ledger.store.EntityKind;
import com.flagship.agreement_ledger.store.IdentifierAllocator;
import com.flagship.agreement_ledger.store.RecordKind;
import com.flagship.agreement_ledger.store.StoreKey;
import com.flagship.agreement_ledger.transaction.Transaction;
import com.flagship.agreement_ledger.transaction.TransactionKind;
import com.flagship.agreement_ledger.transaction.TransactionResult;
import com.flagship.agreement_ledger.transaction.TransactionWorkflow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the ledger. Each method is one host invocation: mutating
 * operations run under the reentrancy guard, reads do not.
 *
 * Every failure is a {@link LedgerException} carrying a {@link LedgerError}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerContract {

    public static final int VERSION = 1;

    private static final StoreKey ADMIN_KEY = StoreKey.singleton(RecordKind.ADMIN);

    private final LedgerHost host;
    private final IdentifierAllocator allocator;
    private final TransactionWorkflow transactions;
    private final EscrowWorkflow escrows;
    private final InvoiceWorkflow invoices;
    private final ApprovalRegistry approvals;

    // Administration

    /**
     * Records the administrator. Re-initialization is refused.
     *
     * @throws LedgerException INVALID_ADDRESS, UNAUTHORIZED if an admin is already set
     */
    public void initialize(Party admin) {
        host.mutate("initialize", ctx -> {
            ctx.getIdentity().validateAddress(admin);
            if (ctx.getStore().has(ADMIN_KEY)) {
                throw LedgerException.of(LedgerError.UNAUTHORIZED, "Ledger is already initialized");
            }
            ctx.getStore().set(ADMIN_KEY, admin);
            log.info("Ledger initialized with admin {}", admin);
            return null;
        });
    }

    public Optional<Party> getAdmin() {
        return host.read("get_admin", ctx -> ctx.getStore().get(ADMIN_KEY, Party.class));
    }

    public int version() {
        return VERSION;
    }

    // Transactions

    public TransactionResult executeTransaction(Party sender, Party recipient, BigInteger amount, String metadata) {
        return host.mutate("execute_transaction", ctx ->
            transactions.create(ctx, TransactionKind.BASIC, sender, recipient, amount, metadata));
    }

    public TransactionResult executeP2pTransaction(Party sender, Party recipient, BigInteger amount, String metadata) {
        return host.mutate("execute_p2p_transaction", ctx ->
            transactions.create(ctx, TransactionKind.P2P, sender, recipient, amount, metadata));
    }

    public Transaction getTransaction(long transactionId) {
        return host.read("get_transaction", ctx -> transactions.get(ctx, transactionId));
    }

    public List<Transaction> getTransactionHistory(Party party) {
        return host.read("get_transaction_history", ctx -> transactions.history(ctx, party));
    }

    public List<Transaction> getTransactionHistory(Party party, int offset, int limit) {
        return host.read("get_transaction_history", ctx -> transactions.history(ctx, party, offset, limit));
    }

    // Escrows

    public EscrowResult createEscrow(Party sender, Party recipient, BigInteger amount,
                                     List<Condition> conditions, long expiresAt) {
        return host.mutate("create_escrow", ctx ->
            escrows.create(ctx, sender, recipient, amount, conditions, expiresAt));
    }

    public boolean checkEscrowConditions(long escrowId) {
        return host.read("check_escrow_conditions", ctx -> escrows.conditionsMet(ctx, escrowId));
    }

    public EscrowResult releaseEscrow(long escrowId) {
        return host.mutate("release_escrow", ctx -> escrows.release(ctx, escrowId));
    }

    public EscrowResult refundEscrow(long escrowId) {
        return host.mutate("refund_escrow", ctx -> escrows.refund(ctx, escrowId));
    }

    public EscrowResult processEscrow(long escrowId) {
        return host.mutate("process_escrow", ctx -> escrows.process(ctx, escrowId));
    }

    public Escrow getEscrowDetails(long escrowId) {
        return host.read("get_escrow_details", ctx -> escrows.get(ctx, escrowId));
    }

    /**
     * Records a validator's approval for manual-approval conditions with
     * these parameters.
     *
     * @throws LedgerException INVALID_ADDRESS, UNAUTHORIZED if the validator did not sign
     */
    public void grantApproval(Party validator, String parameters) {
        host.mutate("grant_approval", ctx -> {
            ctx.getIdentity().validateAddress(validator);
            ctx.getIdentity().requireAuthorized(validator);
            approvals.grant(validator, parameters);
            log.info("Approval granted: validator={}, parameters={}", validator, parameters);
            return null;
        });
    }

    /**
     * @throws LedgerException INVALID_ADDRESS, UNAUTHORIZED if the validator did not sign
     */
    public void revokeApproval(Party validator, String parameters) {
        host.mutate("revoke_approval", ctx -> {
            ctx.getIdentity().validateAddress(validator);
            ctx.getIdentity().requireAuthorized(validator);
            approvals.revoke(validator, parameters);
            log.info("Approval revoked: validator={}, parameters={}", validator, parameters);
            return null;
        });
    }

    /**
     * Highest escrow id issued so far, 0 when none.
     */
    public long lastEscrowId() {
        return host.read("last_escrow_id", ctx -> allocator.current(ctx.getStore(), EntityKind.ESCROW));
    }

    // Invoices

    public InvoiceResult createInvoice(Party creator, Party client, BigInteger amount,
                                       String description, long dueDate) {
        return host.mutate("create_invoice", ctx ->
            invoices.create(ctx, creator, client, amount, description, dueDate));
    }

    public InvoiceResult markInvoiceSent(long invoiceId, Party creator) {
        return host.mutate("mark_invoice_sent", ctx -> invoices.markSent(ctx, invoiceId, creator));
    }

    public InvoiceResult approveInvoice(long invoiceId, Party client) {
        return host.mutate("approve_invoice", ctx -> invoices.approve(ctx, invoiceId, client));
    }

    public InvoiceResult executeInvoice(long invoiceId) {
        return host.mutate("execute_invoice", ctx -> invoices.execute(ctx, invoiceId));
    }

    public InvoiceResult rejectInvoice(long invoiceId, Party client, String reason) {
        return host.mutate("reject_invoice", ctx -> invoices.reject(ctx, invoiceId, client, reason));
    }

    public InvoiceStatus checkInvoiceExpiration(long invoiceId) {
        return host.mutate("check_invoice_expiration", ctx -> invoices.checkExpiration(ctx, invoiceId));
    }

    public Invoice getInvoice(long invoiceId) {
        return host.read("get_invoice", ctx -> invoices.get(ctx, invoiceId));
    }

    /**
     * Highest invoice id issued so far, 0 when none.
     */
    public long lastInvoiceId() {
        return host.read("last_invoice_id", ctx -> allocator.current(ctx.getStore(), EntityKind.INVOICE));
    }
}
