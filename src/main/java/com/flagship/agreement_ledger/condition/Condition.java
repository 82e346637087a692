package com.flagship.agreement_ledger.condition;

import com.flagship.agreement_ledger.common.Party;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A typed predicate attached to an escrow. Immutable once attached; it has no
 * lifecycle of its own.
 */
@Value
@Builder
@Jacksonized
public class Condition {
    ConditionType type;

    /**
     * Opaque parameter blob, JSON by convention. Interpreted only by the
     * predicate for {@link #type}.
     */
    String parameters;

    Party validator;

    public static Condition of(ConditionType type, String parameters, Party validator) {
        return new Condition(type, parameters, validator);
    }
}
