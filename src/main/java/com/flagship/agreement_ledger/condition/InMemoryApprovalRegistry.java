package com.flagship.agreement_ledger.condition;

import com.flagship.agreement_ledger.common.Party;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Approval registry kept in memory. An approval is identified by the
 * validator and the exact parameter blob of the condition it approves.
 */
@Slf4j
public class InMemoryApprovalRegistry implements ApprovalRegistry {

    private final Set<String> approvals = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isApproved(Party validator, String parameters) {
        return approvals.contains(keyOf(validator, parameters));
    }

    @Override
    public void grant(Party validator, String parameters) {
        approvals.add(keyOf(validator, parameters));
        log.info("Approval granted by validator {}", validator);
    }

    @Override
    public void revoke(Party validator, String parameters) {
        approvals.remove(keyOf(validator, parameters));
        log.info("Approval revoked by validator {}", validator);
    }

    private static String keyOf(Party validator, String parameters) {
        return Objects.requireNonNull(validator, "validator").getAddress() + "|" + Objects.toString(parameters, "");
    }
}
