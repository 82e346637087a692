package com.flagship.agreement_ledger.invoice;

import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.contract.LedgerContract;
import com.flagship.agreement_ledger.invoice.dto.CreateInvoiceRequest;
import com.flagship.agreement_ledger.invoice.dto.InvoiceActionRequest;
import com.flagship.agreement_ledger.invoice.dto.InvoiceResponse;
import com.flagship.agreement_ledger.invoice.dto.InvoiceResultResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST endpoints for the invoice lifecycle.
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private final LedgerContract contract;

    @PostMapping
    public ResponseEntity<InvoiceResultResponse> create(@Valid @RequestBody CreateInvoiceRequest request) {
        log.info("Received invoice request: amount={}, dueDate={}", request.getAmount(), request.getDueDate());
        InvoiceResult result = contract.createInvoice(
            Party.of(request.getCreator()),
            Party.of(request.getClient()),
            request.getAmount(),
            request.getDescription(),
            request.getDueDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(InvoiceResultResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable("id") long id) {
        return ResponseEntity.ok(InvoiceResponse.from(contract.getInvoice(id)));
    }

    @PostMapping("/{id}/send")
    public ResponseEntity<InvoiceResultResponse> markSent(@PathVariable("id") long id,
                                                          @Valid @RequestBody InvoiceActionRequest request) {
        return ResponseEntity.ok(InvoiceResultResponse.from(contract.markInvoiceSent(id, Party.of(request.getParty()))));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<InvoiceResultResponse> approve(@PathVariable("id") long id,
                                                         @Valid @RequestBody InvoiceActionRequest request) {
        return ResponseEntity.ok(InvoiceResultResponse.from(contract.approveInvoice(id, Party.of(request.getParty()))));
    }

    @PostMapping("/{id}/execute")
    public ResponseEntity<InvoiceResultResponse> execute(@PathVariable("id") long id) {
        return ResponseEntity.ok(InvoiceResultResponse.from(contract.executeInvoice(id)));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<InvoiceResultResponse> reject(@PathVariable("id") long id,
                                                        @Valid @RequestBody InvoiceActionRequest request) {
        InvoiceResult result = contract.rejectInvoice(id, Party.of(request.getParty()), request.getReason());
        return ResponseEntity.ok(InvoiceResultResponse.from(result));
    }

    @PostMapping("/{id}/expiration-check")
    public ResponseEntity<Map<String, InvoiceStatus>> checkExpiration(@PathVariable("id") long id) {
        return ResponseEntity.ok(Map.of("status", contract.checkInvoiceExpiration(id)));
    }
}
