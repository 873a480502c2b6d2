package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.ledger.dto.LedgerEntryResponse;
import com.flagship.ledger_invoicing.ledger.dto.TransactionBalanceResponse;
import com.flagship.ledger_invoicing.ledger.dto.TransactionHeaderRequest;
import com.flagship.ledger_invoicing.ledger.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Transaction headers plus the read side of their entries.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionService transactionService;
    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(@Valid @RequestBody TransactionHeaderRequest request) {
        log.info("Received transaction creation request: direction={}, createdBy={}",
            request.getDirection(), request.getCreatedBy());
        Transaction transaction = transactionService.createTransaction(request.toDomain());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @GetMapping
    public List<TransactionResponse> listTransactions(
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "period_id", required = false) UUID periodId,
            @RequestParam(value = "direction", required = false) Transaction.Direction direction) {
        TransactionFilter filter = new TransactionFilter(from, to, periodId, direction);
        return transactionService.listTransactions(filter).stream().map(TransactionResponse::from).toList();
    }

    @GetMapping("/{id}")
    public TransactionResponse getTransaction(@PathVariable("id") UUID id) {
        return TransactionResponse.from(transactionService.getTransaction(id));
    }

    @PutMapping("/{id}")
    public TransactionResponse updateTransaction(@PathVariable("id") UUID id,
                                                 @Valid @RequestBody TransactionHeaderRequest request) {
        return TransactionResponse.from(transactionService.updateTransaction(id, request.toDomain()));
    }

    /**
     * Without a {@code policy} parameter the configured default applies.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTransaction(
            @PathVariable("id") UUID id,
            @RequestParam(value = "policy", required = false) TransactionDeletionPolicy policy) {
        if (policy == null) {
            transactionService.deleteTransaction(id);
        } else {
            transactionService.deleteTransaction(id, policy);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/entries")
    public List<LedgerEntryResponse> getEntries(@PathVariable("id") UUID id) {
        return ledgerService.getLedgerEntriesForTransaction(id).stream().map(LedgerEntryResponse::from).toList();
    }

    @GetMapping("/{id}/balance")
    public TransactionBalanceResponse getBalance(@PathVariable("id") UUID id) {
        return TransactionBalanceResponse.from(ledgerService.computeBalance(id));
    }
}
