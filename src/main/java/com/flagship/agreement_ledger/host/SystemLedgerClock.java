package com.flagship.agreement_ledger.host;

import java.time.Clock;

/**
 * Ledger clock backed by a {@link Clock}, reporting epoch seconds. Readings
 * are clamped so the ledger never observes time moving backwards.
 */
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;
    private long last;

    public SystemLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized long now() {
        last = Math.max(last, clock.instant().getEpochSecond());
        return last;
    }
}
