package com.flagship.agreement_ledger.condition;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ManualApprovalPredicate implements ConditionPredicate {

    private final ApprovalRegistry approvalRegistry;

    @Override
    public ConditionType type() {
        return ConditionType.MANUAL_APPROVAL;
    }

    @Override
    public boolean isMet(Condition condition, long timestamp) {
        return approvalRegistry.isApproved(condition.getValidator(), condition.getParameters());
    }
}
