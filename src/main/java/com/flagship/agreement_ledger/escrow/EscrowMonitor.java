package com.flagship.agreement_ledger.escrow;

import com.flagship.agreement_ledger.common.LedgerException;
import com.flagship.agreement_ledger.contract.LedgerContract;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background driver that settles escrows without a caller.
 *
 * Each sweep walks escrow ids 1..last and runs {@code processEscrow} on every
 * ACTIVE escrow, one invocation per escrow. A failure on one escrow is logged
 * and counted; the sweep carries on with the next id.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "ledger.monitor.escrow.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EscrowMonitor {

    private final LedgerContract contract;

    @Scheduled(fixedRateString = "${ledger.monitor.escrow.interval-ms:60000}")
    public void scheduledSweep() {
        try {
            SweepSummary summary = sweep();
            if (summary.getReleased() + summary.getRefunded() + summary.getFailed() > 0) {
                log.info("Escrow sweep finished: {}", summary);
            }
        } catch (Exception e) {
            log.error("Error in escrow monitor sweep", e);
        }
    }

    /**
     * Runs one sweep now.
     */
    public SweepSummary sweep() {
        long last = contract.lastEscrowId();
        int released = 0;
        int refunded = 0;
        int pending = 0;
        int failed = 0;

        for (long id = 1; id <= last; id++) {
            try {
                if (!contract.getEscrowDetails(id).isActive()) {
                    continue;
                }
                EscrowResult result = contract.processEscrow(id);
                switch (result.getStatus()) {
                    case RELEASED -> released++;
                    case REFUNDED -> refunded++;
                    case ACTIVE -> pending++;
                }
            } catch (LedgerException e) {
                failed++;
                log.warn("Escrow {} could not be processed: error={}, message={}", id, e.getError(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("Escrow {} processing aborted", id, e);
            }
        }
        return new SweepSummary(released, refunded, pending, failed);
    }

    @Value
    public static class SweepSummary {
        int released;
        int refunded;
        int pending;
        int failed;
    }
}
