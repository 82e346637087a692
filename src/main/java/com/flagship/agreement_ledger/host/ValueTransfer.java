package com.flagship.agreement_ledger.host;

/**
 * Native value movement between parties, provided by the host.
 */
public interface ValueTransfer {

    /**
     * Executes the transfer and returns its confirmation reference.
     * A failure here is a host fault and aborts the whole invocation.
     */
    String transfer(TransferInstruction instruction);
}
