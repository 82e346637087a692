package com.flagship.agreement_ledger.condition;

/**
 * Kinds of predicates that can gate an escrow release.
 */
public enum ConditionType {
    /**
     * Met once the ledger clock reaches the target time in the parameters.
     */
    TIME_BASED,

    /**
     * Confirmed by an oracle identified by the validator party.
     */
    ORACLE_BASED,

    /**
     * Met once the validator party has granted approval.
     */
    MANUAL_APPROVAL
}
