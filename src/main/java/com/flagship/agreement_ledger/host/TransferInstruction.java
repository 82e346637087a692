package com.flagship.agreement_ledger.host;

import com.flagship.agreement_ledger.common.Party;
import lombok.Value;

import java.math.BigInteger;

/**
 * Instruction to move native value. A null {@code from} or {@code to} stands
 * for the ledger's own custody (escrowed funds).
 */
@Value
public class TransferInstruction {
    TransferPurpose purpose;
    long agreementId;
    Party from;
    Party to;
    BigInteger amount;
}
