package com.flagship.agreement_ledger.host;

import com.flagship.agreement_ledger.store.LedgerStore;

/**
 * Held exclusion returned by {@link ReentrancyGuard#enter(LedgerStore)}.
 * Closing it releases the guard; closing twice is a no-op.
 */
public final class GuardPermit implements AutoCloseable {

    private final ReentrancyGuard guard;
    private final LedgerStore store;
    private boolean released;

    GuardPermit(ReentrancyGuard guard, LedgerStore store) {
        this.guard = guard;
        this.store = store;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            guard.leave(store);
        }
    }
}
