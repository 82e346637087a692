package com.flagship.agreement_ledger.escrow;

import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.contract.LedgerContract;
import com.flagship.agreement_ledger.escrow.dto.ApprovalRequest;
import com.flagship.agreement_ledger.escrow.dto.ConditionRequest;
import com.flagship.agreement_ledger.escrow.dto.CreateEscrowRequest;
import com.flagship.agreement_ledger.escrow.dto.EscrowResponse;
import com.flagship.agreement_ledger.escrow.dto.EscrowResultResponse;
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
 * REST endpoints for conditional escrows, plus the approval endpoints used by
 * validators of manual-approval conditions.
 */
@RestController
@RequestMapping("/api/escrows")
@RequiredArgsConstructor
@Slf4j
public class EscrowController {

    private final LedgerContract contract;

    @PostMapping
    public ResponseEntity<EscrowResultResponse> create(@Valid @RequestBody CreateEscrowRequest request) {
        log.info("Received escrow request: amount={}, conditions={}, expiresAt={}",
            request.getAmount(), request.getConditions().size(), request.getExpiresAt());
        EscrowResult result = contract.createEscrow(
            Party.of(request.getSender()),
            Party.of(request.getRecipient()),
            request.getAmount(),
            request.getConditions().stream().map(ConditionRequest::toCondition).toList(),
            request.getExpiresAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(EscrowResultResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EscrowResponse> getEscrow(@PathVariable("id") long id) {
        return ResponseEntity.ok(EscrowResponse.from(contract.getEscrowDetails(id)));
    }

    @GetMapping("/{id}/conditions")
    public ResponseEntity<Map<String, Boolean>> checkConditions(@PathVariable("id") long id) {
        return ResponseEntity.ok(Map.of("conditions_met", contract.checkEscrowConditions(id)));
    }

    @PostMapping("/{id}/release")
    public ResponseEntity<EscrowResultResponse> release(@PathVariable("id") long id) {
        return ResponseEntity.ok(EscrowResultResponse.from(contract.releaseEscrow(id)));
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<EscrowResultResponse> refund(@PathVariable("id") long id) {
        return ResponseEntity.ok(EscrowResultResponse.from(contract.refundEscrow(id)));
    }

    @PostMapping("/{id}/process")
    public ResponseEntity<EscrowResultResponse> process(@PathVariable("id") long id) {
        return ResponseEntity.ok(EscrowResultResponse.from(contract.processEscrow(id)));
    }

    @PostMapping("/approvals")
    public ResponseEntity<Void> grantApproval(@Valid @RequestBody ApprovalRequest request) {
        contract.grantApproval(Party.of(request.getValidator()), request.getParameters());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/approvals/revoke")
    public ResponseEntity<Void> revokeApproval(@Valid @RequestBody ApprovalRequest request) {
        contract.revokeApproval(Party.of(request.getValidator()), request.getParameters());
        return ResponseEntity.noContent().build();
    }
}
