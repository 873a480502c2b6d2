package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.common.Money;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import com.flagship.ledger_invoicing.observability.CorrelationContext;
import com.flagship.ledger_invoicing.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes individual ledger entries and answers balance queries.
 *
 * Two separate operations:
 * 1. Entry writes check only the entry itself (references exist, exactly one
 *    side positive). A transaction may be unbalanced between writes.
 * 2. {@link #computeBalance(UUID)} sums a transaction's entries on demand and
 *    is never called from a write path.
 *
 * Every entry mutation holds the parent transaction's row lock for the
 * duration of its unit of work.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final String SELECT_ENTRY =
        "SELECT id, transaction_id, account_id, debit, credit, sequence_number, created_at FROM ledger_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerEntryValidator validator;
    private final TransactionService transactionService;
    private final AccountService accountService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Validates and persists one entry. No other entry is touched.
     *
     * @throws NotFoundException if the transaction or the account does not exist
     * @throws ConstraintViolationException if the entry is not exactly one of debit or credit
     */
    @Transactional
    public LedgerEntry recordEntry(LedgerEntryRequest request) {
        requireReferences(request);
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, request.getTransactionId().toString());
        try {
            checkEntry(request.getTransactionId(), request);

            UUID entryId = UUID.randomUUID();
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, transaction_id, account_id, debit, credit, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?)",
                entryId,
                request.getTransactionId(),
                request.getAccountId(),
                Money.normalize(request.getDebit()),
                Money.normalize(request.getCredit()),
                Timestamp.from(Instant.now())
            );

            LedgerEntry entry = getEntry(entryId);
            ledgerMetrics.recordEntryAccepted("record");
            log.info("Recorded {} entry {} of {} on account {}",
                entry.getEntryType(), entryId, entry.getAmount(), entry.getAccountId());
            return entry;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Re-validates and rewrites an existing entry's account and amounts.
     * An entry stays with the transaction it was created under.
     */
    @Transactional
    public LedgerEntry updateEntry(UUID entryId, LedgerEntryRequest request) {
        LedgerEntry existing = getEntry(entryId);
        UUID transactionId = existing.getTransactionId();
        if (request.getTransactionId() != null && !request.getTransactionId().equals(transactionId)) {
            ledgerMetrics.recordEntryRejected("transaction_change");
            throw new ConstraintViolationException(
                "Ledger entry " + entryId + " cannot be moved to another transaction");
        }
        if (request.getAccountId() == null) {
            throw new ConstraintViolationException("Ledger entry account is required");
        }

        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            checkEntry(transactionId, request);

            int updated = jdbcTemplate.update(
                "UPDATE ledger_entries SET account_id = ?, debit = ?, credit = ? WHERE id = ?",
                request.getAccountId(),
                Money.normalize(request.getDebit()),
                Money.normalize(request.getCredit()),
                entryId
            );
            if (updated == 0) {
                throw new NotFoundException("LedgerEntry", entryId);
            }

            LedgerEntry entry = getEntry(entryId);
            ledgerMetrics.recordEntryAccepted("update");
            log.info("Updated entry {} to {} {}", entryId, entry.getEntryType(), entry.getAmount());
            return entry;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    @Transactional
    public void deleteEntry(UUID entryId) {
        LedgerEntry existing = getEntry(entryId);
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, existing.getTransactionId().toString());
        try {
            transactionService.lockForUpdate(existing.getTransactionId());
            int deleted = jdbcTemplate.update("DELETE FROM ledger_entries WHERE id = ?", entryId);
            if (deleted == 0) {
                throw new NotFoundException("LedgerEntry", entryId);
            }
            log.info("Deleted entry {}", entryId);
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Sums debit and credit over all entries of a transaction. Pure read.
     *
     * @throws NotFoundException if the transaction does not exist
     */
    @Transactional(readOnly = true)
    public TransactionBalance computeBalance(UUID transactionId) {
        if (transactionService.findById(transactionId).isEmpty()) {
            throw new NotFoundException("Transaction", transactionId);
        }

        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS total_debit, COALESCE(SUM(credit), 0) AS total_credit " +
            "FROM ledger_entries WHERE transaction_id = ?",
            (rs, rowNum) -> TransactionBalance.of(
                transactionId,
                Money.normalize(rs.getBigDecimal("total_debit")),
                Money.normalize(rs.getBigDecimal("total_credit"))
            ),
            transactionId
        );
    }

    /**
     * Balance of an account read on its normal side: debit minus credit for
     * ASSET and EXPENSE, credit minus debit otherwise.
     */
    @Transactional(readOnly = true)
    public AccountBalance getAccountBalance(UUID accountId) {
        Account account = accountService.getAccount(accountId);

        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS total_debit, COALESCE(SUM(credit), 0) AS total_credit " +
            "FROM ledger_entries WHERE account_id = ?",
            (rs, rowNum) -> {
                BigDecimal debit = Money.normalize(rs.getBigDecimal("total_debit"));
                BigDecimal credit = Money.normalize(rs.getBigDecimal("total_credit"));
                BigDecimal balance = account.getAccountType().isDebitNormal()
                    ? debit.subtract(credit)
                    : credit.subtract(debit);
                return new AccountBalance(accountId, account.getCode(), account.getAccountType(),
                    debit, credit, balance);
            },
            accountId
        );
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findEntry(UUID entryId) {
        return jdbcTemplate.query(SELECT_ENTRY + "WHERE id = ?", ledgerEntryRowMapper(), entryId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public LedgerEntry getEntry(UUID entryId) {
        return findEntry(entryId).orElseThrow(() -> new NotFoundException("LedgerEntry", entryId));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        if (transactionService.findById(transactionId).isEmpty()) {
            throw new NotFoundException("Transaction", transactionId);
        }
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE transaction_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transactionId
        );
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getLedgerEntriesForAccount(UUID accountId) {
        if (!accountService.exists(accountId)) {
            throw new NotFoundException("Account", accountId);
        }
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE account_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            accountId
        );
    }

    /**
     * Locks the parent transaction, then checks the account reference and the
     * entry's amounts. Order matters: a missing transaction is reported before
     * anything else.
     */
    private void checkEntry(UUID transactionId, LedgerEntryRequest request) {
        try {
            transactionService.lockForUpdate(transactionId);

            if (!accountService.exists(request.getAccountId())) {
                throw new NotFoundException("Account", request.getAccountId());
            }

            validator.validate(request.getDebit(), request.getCredit());
        } catch (NotFoundException e) {
            ledgerMetrics.recordEntryRejected("not_found");
            throw e;
        } catch (ConstraintViolationException e) {
            ledgerMetrics.recordEntryRejected("constraint_violation");
            log.warn("Rejected ledger entry: {}", e.getMessage());
            throw e;
        }
    }

    private void requireReferences(LedgerEntryRequest request) {
        if (request.getTransactionId() == null) {
            throw new ConstraintViolationException("Ledger entry transaction is required");
        }
        if (request.getAccountId() == null) {
            throw new ConstraintViolationException("Ledger entry account is required");
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transaction_id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getLong("sequence_number"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
