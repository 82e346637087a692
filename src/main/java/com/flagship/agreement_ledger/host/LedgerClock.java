package com.flagship.agreement_ledger.host;

/**
 * Ledger time source. Timestamps are seconds and never go backwards; the
 * engine samples the clock once per invocation.
 */
public interface LedgerClock {

    long now();
}
