package com.flagship.agreement_ledger.common;

import java.math.BigInteger;

/**
 * Amount rules shared by every creation path.
 *
 * Amounts are signed 128-bit integers. A valid amount is strictly positive
 * and at most half of the largest representable value, which leaves headroom
 * for summing two amounts without overflow.
 */
public final class Amounts {

    public static final BigInteger I128_MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

    public static final BigInteger MAX_AMOUNT = I128_MAX.divide(BigInteger.TWO);

    private Amounts() {
    }

    public static boolean isValid(BigInteger amount) {
        return amount != null
                && amount.signum() > 0
                && amount.compareTo(MAX_AMOUNT) <= 0;
    }

    /**
     * @throws LedgerException with {@link LedgerError#INVALID_AMOUNT} if the amount is not valid
     */
    public static void requireValid(BigInteger amount) {
        if (!isValid(amount)) {
            throw LedgerException.of(LedgerError.INVALID_AMOUNT,
                    "Amount must be positive and at most %s, got %s", MAX_AMOUNT, amount);
        }
    }
}
