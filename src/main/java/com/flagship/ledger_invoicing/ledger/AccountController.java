package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.ledger.dto.AccountBalanceResponse;
import com.flagship.ledger_invoicing.ledger.dto.AccountResponse;
import com.flagship.ledger_invoicing.ledger.dto.CreateAccountRequest;
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
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Chart of accounts administration.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request: code={}, type={}", request.getCode(), request.getAccountType());
        Account account = accountService.createAccount(request.getCode(), request.getName(), request.getAccountType());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts() {
        return accountService.listAccounts().stream().map(AccountResponse::from).toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.getAccount(id));
    }

    @GetMapping("/{id}/balance")
    public AccountBalanceResponse getBalance(@PathVariable("id") UUID id) {
        return AccountBalanceResponse.from(ledgerService.getAccountBalance(id));
    }

    @GetMapping("/{id}/entries")
    public List<LedgerEntryResponse> getEntries(@PathVariable("id") UUID id) {
        return ledgerService.getLedgerEntriesForAccount(id).stream().map(LedgerEntryResponse::from).toList();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable("id") UUID id) {
        accountService.deleteAccount(id);
        return ResponseEntity.noContent().build();
    }
}
