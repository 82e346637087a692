package com.flagship.agreement_ledger.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Objects;

/**
 * Opaque reference to a principal (sender, recipient, creator, client,
 * validator). Only equality is meaningful to the engine; whether the
 * reference is well formed and authorized is decided by the host.
 */
@Value
public class Party {
    String address;

    private Party(String address) {
        this.address = Objects.requireNonNull(address, "address");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Party of(String address) {
        return new Party(address);
    }

    @JsonValue
    public String getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return address;
    }
}
