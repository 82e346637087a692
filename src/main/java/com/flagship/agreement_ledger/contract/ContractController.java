package com.flagship.agreement_ledger.contract;

import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.contract.dto.InitializeRequest;
import com.flagship.agreement_ledger.contract.dto.LedgerInfoResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ledger administration: initialization, version and admin lookup.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class ContractController {

    private final LedgerContract contract;

    @PostMapping("/initialize")
    public ResponseEntity<LedgerInfoResponse> initialize(@Valid @RequestBody InitializeRequest request) {
        contract.initialize(Party.of(request.getAdmin()));
        return ResponseEntity.status(HttpStatus.CREATED).body(info());
    }

    @GetMapping
    public ResponseEntity<LedgerInfoResponse> getInfo() {
        return ResponseEntity.ok(info());
    }

    @GetMapping("/version")
    public ResponseEntity<Integer> version() {
        return ResponseEntity.ok(contract.version());
    }

    private LedgerInfoResponse info() {
        String admin = contract.getAdmin().map(Party::getAddress).orElse(null);
        return new LedgerInfoResponse(contract.version(), admin);
    }
}
