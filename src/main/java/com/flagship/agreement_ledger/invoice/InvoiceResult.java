package com.flagship.agreement_ledger.invoice;

import lombok.Value;

/**
 * Outcome of an invoice operation. The payment reference is present only
 * after execution.
 */
@Value
public class InvoiceResult {
    long invoiceId;
    InvoiceStatus status;
    String paymentReference;
}
