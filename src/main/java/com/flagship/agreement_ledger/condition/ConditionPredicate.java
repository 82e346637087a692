package com.flagship.agreement_ledger.condition;

/**
 * Adjudicates one condition type. Implementations must be side-effect free
 * and give the same answer for the same condition and timestamp.
 */
public interface ConditionPredicate {

    ConditionType type();

    boolean isMet(Condition condition, long timestamp);
}
