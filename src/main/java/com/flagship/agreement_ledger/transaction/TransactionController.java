package com.flagship.agreement_ledger.transaction;

import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.contract.LedgerContract;
import com.flagship.agreement_ledger.transaction.dto.ExecuteTransactionRequest;
import com.flagship.agreement_ledger.transaction.dto.TransactionResponse;
import com.flagship.agreement_ledger.transaction.dto.TransactionResultResponse;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for direct and P2P transactions.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final LedgerContract contract;

    @PostMapping
    public ResponseEntity<TransactionResultResponse> execute(@Valid @RequestBody ExecuteTransactionRequest request) {
        log.info("Received transaction request: amount={}", request.getAmount());
        TransactionResult result = contract.executeTransaction(
            Party.of(request.getSender()), Party.of(request.getRecipient()), request.getAmount(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResultResponse.from(result));
    }

    @PostMapping("/p2p")
    public ResponseEntity<TransactionResultResponse> executeP2p(@Valid @RequestBody ExecuteTransactionRequest request) {
        log.info("Received P2P transaction request: amount={}", request.getAmount());
        TransactionResult result = contract.executeP2pTransaction(
            Party.of(request.getSender()), Party.of(request.getRecipient()), request.getAmount(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResultResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") long id) {
        return ResponseEntity.ok(TransactionResponse.from(contract.getTransaction(id)));
    }

    /**
     * Whole history, or one page when offset or limit is given.
     */
    @GetMapping("/history/{party}")
    public ResponseEntity<List<TransactionResponse>> getHistory(
            @PathVariable("party") String party,
            @RequestParam(name = "offset", required = false) Integer offset,
            @RequestParam(name = "limit", required = false) Integer limit) {
        List<Transaction> history = offset == null && limit == null
            ? contract.getTransactionHistory(Party.of(party))
            : contract.getTransactionHistory(Party.of(party),
                offset == null ? 0 : offset,
                limit == null ? TransactionWorkflow.MAX_PAGE_SIZE : limit);
        return ResponseEntity.ok(history.stream().map(TransactionResponse::from).toList());
    }
}
