package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.ledger.dto.LedgerEntryPayload;
import com.flagship.ledger_invoicing.ledger.dto.LedgerEntryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/ledger-entries")
@RequiredArgsConstructor
@Slf4j
public class LedgerEntryController {

    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<LedgerEntryResponse> recordEntry(@Valid @RequestBody LedgerEntryPayload payload) {
        log.info("Received ledger entry: transaction={}, account={}, debit={}, credit={}",
            payload.getTransactionId(), payload.getAccountId(), payload.getDebit(), payload.getCredit());
        LedgerEntry entry = ledgerService.recordEntry(payload.toDomain());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
    }

    @GetMapping("/{id}")
    public LedgerEntryResponse getEntry(@PathVariable("id") UUID id) {
        return LedgerEntryResponse.from(ledgerService.getEntry(id));
    }

    @PutMapping("/{id}")
    public LedgerEntryResponse updateEntry(@PathVariable("id") UUID id,
                                           @Valid @RequestBody LedgerEntryPayload payload) {
        return LedgerEntryResponse.from(ledgerService.updateEntry(id, payload.toDomain()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("id") UUID id) {
        ledgerService.deleteEntry(id);
        return ResponseEntity.noContent().build();
    }
}
