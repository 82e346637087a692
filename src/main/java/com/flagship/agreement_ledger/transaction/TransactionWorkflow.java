package com.flagship.agreement_ledger.transaction;

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
import com.flagship.agreement_ledger.store.LedgerStore;
import com.flagship.agreement_ledger.store.PartyIndex;
import com.flagship.agreement_ledger.store.RecordKind;
import com.flagship.agreement_ledger.store.StoreKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Direct and peer-to-peer transactions.
 *
 * State machine: PENDING → CONFIRMED, both writes inside one invocation.
 * Every transaction is also appended to the history index of its sender and
 * recipient, in the same staged batch as the record itself.
 *
 * The PENDING record and the index entries are written before the value
 * transfer. If the transfer fails, or is rejected because it called back into
 * the ledger, the host discards the whole batch: no record, no index entry
 * and no consumed id survive.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionWorkflow {

    public static final int MAX_PAGE_SIZE = 500;

    private final IdentifierAllocator allocator;
    private final LedgerMetrics metrics;

    /**
     * Records and executes a transfer.
     *
     * @throws LedgerException INVALID_ADDRESS if a party is not valid,
     *         INVALID_AMOUNT if the amount is not positive or exceeds the headroom bound,
     *         UNAUTHORIZED if the sender did not authorize the transfer
     */
    public TransactionResult create(InvocationContext context, TransactionKind kind, Party sender,
                                    Party recipient, BigInteger amount, String metadata) {
        // Validate inputs
        context.getIdentity().validateAddress(sender);
        context.getIdentity().validateAddress(recipient);
        Amounts.requireValid(amount);
        context.getIdentity().requireAuthorized(sender);

        // Record as PENDING and index for both parties
        LedgerStore store = context.getStore();
        long id = allocator.next(store, EntityKind.TRANSACTION);
        StoreKey key = StoreKey.of(EntityKind.TRANSACTION, id);

        Transaction pending = Transaction.pending(
            id, kind, sender, recipient, amount, context.getTimestamp(), metadata);
        store.set(key, pending);
        appendToHistory(store, sender, id);
        if (!recipient.equals(sender)) {
            appendToHistory(store, recipient, id);
        }

        // Move the funds
        String reference = context.getTransfers().transfer(
            new TransferInstruction(purposeOf(kind), id, sender, recipient, amount));

        // Confirm
        Transaction confirmed = pending.confirm();
        store.set(key, confirmed);
        metrics.recordTransition("transaction", confirmed.getStatus().name());

        log.info("Transaction confirmed: transactionId={}, kind={}, amount={}", id, kind, amount);
        return new TransactionResult(id, confirmed.getStatus(), reference);
    }

    /**
     * @throws LedgerException TRANSACTION_NOT_FOUND if there is no such transaction
     */
    public Transaction get(InvocationContext context, long transactionId) {
        return context.getStore().get(StoreKey.of(EntityKind.TRANSACTION, transactionId), Transaction.class)
            .orElseThrow(() -> LedgerException.of(LedgerError.TRANSACTION_NOT_FOUND,
                "Transaction not found: %d", transactionId));
    }

    /**
     * All transactions the party sent or received, oldest first.
     */
    public List<Transaction> history(InvocationContext context, Party party) {
        context.getIdentity().validateAddress(party);
        return load(context, indexOf(context.getStore(), party).getIds());
    }

    /**
     * One page of the party's history, oldest first.
     *
     * @throws IllegalArgumentException if offset is negative or limit is outside 1..{@value #MAX_PAGE_SIZE}
     */
    public List<Transaction> history(InvocationContext context, Party party, int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        context.getIdentity().validateAddress(party);
        return load(context, indexOf(context.getStore(), party).page(offset, limit));
    }

    private List<Transaction> load(InvocationContext context, List<Long> ids) {
        List<Transaction> transactions = new ArrayList<>(ids.size());
        for (Long id : ids) {
            Transaction transaction = context.getStore()
                .get(StoreKey.of(EntityKind.TRANSACTION, id), Transaction.class)
                .orElseThrow(() -> new IllegalStateException("History index points at missing transaction " + id));
            transactions.add(transaction);
        }
        return transactions;
    }

    private void appendToHistory(LedgerStore store, Party party, long transactionId) {
        store.set(historyKey(party), indexOf(store, party).append(transactionId));
    }

    private PartyIndex indexOf(LedgerStore store, Party party) {
        return store.get(historyKey(party), PartyIndex.class).orElseGet(PartyIndex::empty);
    }

    private static StoreKey historyKey(Party party) {
        return StoreKey.forParty(RecordKind.PARTY_TRANSACTIONS, party);
    }

    private static TransferPurpose purposeOf(TransactionKind kind) {
        return switch (kind) {
            case BASIC -> TransferPurpose.TRANSACTION;
            case P2P -> TransferPurpose.P2P;
        };
    }
}
