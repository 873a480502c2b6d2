package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import com.flagship.ledger_invoicing.exception.ReferentialIntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Chart of accounts. Accounts are plain reference rows; once a ledger entry
 * points at one it can no longer be deleted.
 */
@Service
@Slf4j
public class AccountService {

    private static final String SELECT_ACCOUNT =
        "SELECT id, code, name, account_type, created_at FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public Account createAccount(String code, String name, Account.AccountType accountType) {
        if (code == null || code.isBlank()) {
            throw new ConstraintViolationException("Account code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ConstraintViolationException("Account name is required");
        }
        if (accountType == null) {
            throw new ConstraintViolationException("Account type is required");
        }

        UUID accountId = UUID.randomUUID();
        Instant now = Instant.now();
        try {
            jdbcTemplate.update(
                "INSERT INTO accounts (id, code, name, account_type, created_at) VALUES (?, ?, ?, ?, ?)",
                accountId,
                code.trim(),
                name.trim(),
                accountType.name(),
                Timestamp.from(now)
            );
        } catch (DuplicateKeyException e) {
            throw new ConstraintViolationException("Account code already exists: " + code.trim());
        }

        log.info("Created account {} ({}, {})", code.trim(), accountType, accountId);
        return new Account(accountId, code.trim(), name.trim(), accountType, now);
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID accountId) {
        List<Account> rows = jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = ?", accountRowMapper(), accountId);
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID accountId) {
        return findById(accountId).orElseThrow(() -> new NotFoundException("Account", accountId));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts() {
        return jdbcTemplate.query(SELECT_ACCOUNT + "ORDER BY code", accountRowMapper());
    }

    public boolean exists(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE id = ?",
            Integer.class,
            accountId
        );
        return count != null && count > 0;
    }

    /**
     * Deletes an account that no ledger entry references.
     *
     * @throws NotFoundException if the account does not exist
     * @throws ReferentialIntegrityException if any entry references it
     */
    @Transactional
    public void deleteAccount(UUID accountId) {
        if (!exists(accountId)) {
            throw new NotFoundException("Account", accountId);
        }

        Integer references = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE account_id = ?",
            Integer.class,
            accountId
        );
        if (references != null && references > 0) {
            throw new ReferentialIntegrityException(
                String.format("Account %s is referenced by %d ledger entries and cannot be deleted",
                    accountId, references));
        }

        try {
            jdbcTemplate.update("DELETE FROM accounts WHERE id = ?", accountId);
        } catch (DataIntegrityViolationException e) {
            // An entry was written between the check and the delete
            throw new ReferentialIntegrityException(
                "Account " + accountId + " is referenced by ledger entries and cannot be deleted", e);
        }
        log.info("Deleted account {}", accountId);
    }

    static RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            rs.getString("code"),
            rs.getString("name"),
            Account.AccountType.valueOf(rs.getString("account_type")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
