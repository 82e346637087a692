package com.flagship.agreement_ledger.condition;

import com.flagship.agreement_ledger.common.Party;
import lombok.extern.slf4j.Slf4j;

/**
 * Stand-in oracle that answers every query with a configured outcome.
 */
@Slf4j
public class ConfiguredOracleGateway implements OracleGateway {

    private final boolean outcome;

    public ConfiguredOracleGateway(boolean outcome) {
        this.outcome = outcome;
    }

    @Override
    public boolean confirms(Party oracle, String parameters) {
        log.debug("No oracle backend configured, answering {} for oracle {}", outcome, oracle);
        return outcome;
    }
}
