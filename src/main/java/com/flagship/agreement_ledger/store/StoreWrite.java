package com.flagship.agreement_ledger.store;

import lombok.Value;

/**
 * A pending write: either an overwrite with a whole record or a removal.
 */
@Value
public class StoreWrite {
    StoreKey key;
    Object record;

    public static StoreWrite put(StoreKey key, Object record) {
        return new StoreWrite(key, record);
    }

    public static StoreWrite removal(StoreKey key) {
        return new StoreWrite(key, null);
    }

    public boolean isRemoval() {
        return record == null;
    }
}
