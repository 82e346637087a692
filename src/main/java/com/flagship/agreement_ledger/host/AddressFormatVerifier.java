package com.flagship.agreement_ledger.host;

import com.flagship.agreement_ledger.common.LedgerError;
import com.flagship.agreement_ledger.common.LedgerException;
import com.flagship.agreement_ledger.common.Party;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Default verifier: a party is valid when its address matches the configured
 * pattern (Stellar account or contract strkey by default).
 *
 * Signatures are checked by the host before a call reaches the engine, so a
 * well-formed party counts as authorized here.
 */
@Slf4j
public class AddressFormatVerifier implements IdentityVerifier {

    public static final String STRKEY_PATTERN = "^[GC][A-Z2-7]{55}$";

    private final Pattern addressPattern;

    public AddressFormatVerifier(String addressPattern) {
        this.addressPattern = Pattern.compile(addressPattern);
    }

    @Override
    public void validateAddress(Party party) {
        if (party == null || !addressPattern.matcher(party.getAddress()).matches()) {
            throw LedgerException.of(LedgerError.INVALID_ADDRESS, "Invalid party address: %s", party);
        }
    }

    @Override
    public void requireAuthorized(Party party) {
        if (party == null || !addressPattern.matcher(party.getAddress()).matches()) {
            log.warn("Authorization refused for malformed party {}", party);
            throw LedgerException.of(LedgerError.UNAUTHORIZED, "Party is not authorized: %s", party);
        }
    }
}
