package com.flagship.agreement_ledger;

import com.flagship.agreement_ledger.host.LedgerClock;

/**
 * Ledger clock moved by hand between invocations.
 */
public class MutableLedgerClock implements LedgerClock {

    private long now;

    public MutableLedgerClock(long start) {
        this.now = start;
    }

    @Override
    public synchronized long now() {
        return now;
    }

    public synchronized void set(long timestamp) {
        this.now = timestamp;
    }

    public synchronized void advance(long seconds) {
        this.now += seconds;
    }
}
