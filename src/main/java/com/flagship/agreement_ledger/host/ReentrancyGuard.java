package com.flagship.agreement_ledger.host;

import com.flagship.agreement_ledger.common.LedgerError;
import com.flagship.agreement_ledger.common.LedgerException;
import com.flagship.agreement_ledger.store.LedgerStore;
import com.flagship.agreement_ledger.store.RecordKind;
import com.flagship.agreement_ledger.store.StoreKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single ledger-wide exclusion flag for mutating operations.
 *
 * The flag lives in the ledger store, so a nested call that joins the running
 * invocation sees it. It is not a per-entity lock: while it is set, no other
 * mutating operation may start.
 */
@Component
@Slf4j
public class ReentrancyGuard {

    private static final StoreKey FLAG = StoreKey.singleton(RecordKind.REENTRANCY_FLAG);

    /**
     * Sets the flag if it is clear.
     *
     * @return a permit that clears the flag when closed
     * @throws LedgerException with REENTRANCY_DETECTED if the flag is already set
     */
    public GuardPermit enter(LedgerStore store) {
        if (store.has(FLAG)) {
            log.warn("Reentrant call rejected");
            throw new LedgerException(LedgerError.REENTRANCY_DETECTED,
                    "A mutating operation is already in progress");
        }
        store.set(FLAG, Boolean.TRUE);
        return new GuardPermit(this, store);
    }

    public void leave(LedgerStore store) {
        store.remove(FLAG);
    }

    public boolean isHeld(LedgerStore store) {
        return store.has(FLAG);
    }
}
