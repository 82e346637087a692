package com.flagship.agreement_ledger.condition;

import com.flagship.agreement_ledger.common.Party;

/**
 * Records approvals given by validator parties for
 * {@link ConditionType#MANUAL_APPROVAL} conditions.
 */
public interface ApprovalRegistry {

    boolean isApproved(Party validator, String parameters);

    /**
     * Records the validator's approval of the condition with these parameters.
     */
    void grant(Party validator, String parameters);

    void revoke(Party validator, String parameters);
}
