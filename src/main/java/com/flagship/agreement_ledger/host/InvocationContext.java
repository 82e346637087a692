package com.flagship.agreement_ledger.host;

import com.flagship.agreement_ledger.store.LedgerStore;
import lombok.Value;

/**
 * Everything a workflow may touch during one invocation: the staged store,
 * the ledger timestamp frozen at invocation start, and the host
 * collaborators. Passed explicitly into every workflow call.
 */
@Value
public class InvocationContext {
    String operation;
    LedgerStore store;
    long timestamp;
    IdentityVerifier identity;
    ValueTransfer transfers;
    ReentrancyGuard guard;

    /**
     * Acquires the reentrancy guard for this invocation.
     */
    public GuardPermit enterExclusive() {
        return guard.enter(store);
    }
}
