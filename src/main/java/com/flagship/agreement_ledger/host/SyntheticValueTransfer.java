package com.flagship.agreement_ledger.host;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Value transfer that moves nothing and returns a deterministic reference:
 * the hex SHA-256 of the instruction. Replaying the same instruction yields
 * the same reference.
 */
@Slf4j
public class SyntheticValueTransfer implements ValueTransfer {

    @Override
    public String transfer(TransferInstruction instruction) {
        String canonical = String.join("|",
            instruction.getPurpose().name(),
            Long.toString(instruction.getAgreementId()),
            instruction.getFrom() == null ? "custody" : instruction.getFrom().getAddress(),
            instruction.getTo() == null ? "custody" : instruction.getTo().getAddress(),
            instruction.getAmount().toString()
        );
        String reference = sha256Hex(canonical);
        log.debug("Synthetic transfer: purpose={}, agreementId={}, reference={}",
                instruction.getPurpose(), instruction.getAgreementId(), reference);
        return reference;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
