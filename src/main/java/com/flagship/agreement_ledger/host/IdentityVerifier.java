package com.flagship.agreement_ledger.host;

import com.flagship.agreement_ledger.common.Party;

/**
 * Host-side identity checks consumed by the workflows.
 */
public interface IdentityVerifier {

    /**
     * @throws com.flagship.agreement_ledger.common.LedgerException with INVALID_ADDRESS
     *         if the reference is not a valid party
     */
    void validateAddress(Party party);

    /**
     * Requires that the current caller proved control of {@code party}.
     *
     * @throws com.flagship.agreement_ledger.common.LedgerException with UNAUTHORIZED
     *         (or INVALID_SIGNATURE) otherwise
     */
    void requireAuthorized(Party party);
}
