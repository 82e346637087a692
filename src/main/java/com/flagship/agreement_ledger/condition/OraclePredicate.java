package com.flagship.agreement_ledger.condition;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OraclePredicate implements ConditionPredicate {

    private final OracleGateway oracleGateway;

    @Override
    public ConditionType type() {
        return ConditionType.ORACLE_BASED;
    }

    @Override
    public boolean isMet(Condition condition, long timestamp) {
        return oracleGateway.confirms(condition.getValidator(), condition.getParameters());
    }
}
