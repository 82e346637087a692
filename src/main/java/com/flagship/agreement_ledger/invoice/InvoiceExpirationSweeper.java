package com.flagship.agreement_ledger.invoice;

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
 * Expires overdue SENT and APPROVED invoices in the background.
 *
 * One invocation per invoice. A failure on one invoice is logged and counted;
 * the sweep carries on with the next id.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "ledger.monitor.invoice.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InvoiceExpirationSweeper {

    private final LedgerContract contract;

    @Scheduled(fixedRateString = "${ledger.monitor.invoice.interval-ms:60000}")
    public void scheduledSweep() {
        try {
            SweepSummary summary = sweep();
            if (summary.getExpired() + summary.getFailed() > 0) {
                log.info("Invoice sweep finished: {}", summary);
            }
        } catch (Exception e) {
            log.error("Error in invoice expiration sweep", e);
        }
    }

    /**
     * Runs one sweep now.
     */
    public SweepSummary sweep() {
        long last = contract.lastInvoiceId();
        int expired = 0;
        int failed = 0;
        for (long id = 1; id <= last; id++) {
            try {
                InvoiceStatus status = contract.getInvoice(id).getStatus();
                if (status != InvoiceStatus.SENT && status != InvoiceStatus.APPROVED) {
                    continue;
                }
                if (contract.checkInvoiceExpiration(id) == InvoiceStatus.EXPIRED) {
                    expired++;
                }
            } catch (LedgerException e) {
                failed++;
                log.warn("Invoice {} expiration check failed: error={}, message={}", id, e.getError(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("Invoice {} expiration check aborted", id, e);
            }
        }
        return new SweepSummary(expired, failed);
    }

    @Value
    public static class SweepSummary {
        int expired;
        int failed;
    }
}
