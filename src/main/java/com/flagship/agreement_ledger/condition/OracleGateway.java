package com.flagship.agreement_ledger.condition;

import com.flagship.agreement_ledger.common.Party;

/**
 * External oracle backend for {@link ConditionType#ORACLE_BASED} conditions.
 */
public interface OracleGateway {

    boolean confirms(Party oracle, String parameters);
}
