package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.exception.ConcurrencyConflictException;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import com.flagship.ledger_invoicing.exception.ReferentialIntegrityException;
import com.flagship.ledger_invoicing.observability.CorrelationContext;
import com.flagship.ledger_invoicing.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transaction headers: creation, filtered listing, header updates and
 * deletion under an explicit {@link TransactionDeletionPolicy}.
 *
 * The header row doubles as the serialization point for entry mutations:
 * {@link #lockForUpdate(UUID)} takes a row lock that {@link LedgerService}
 * holds while it writes an entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private static final String SELECT_TRANSACTION =
        "SELECT id, occurred_at, description, direction, currency, created_by, period_id, created_at " +
        "FROM transactions ";

    private final JdbcTemplate jdbcTemplate;
    private final PeriodService periodService;
    private final LedgerMetrics ledgerMetrics;

    @Value("${ledger.transaction.deletion-policy:REJECT_IF_ENTRIES}")
    private TransactionDeletionPolicy defaultDeletionPolicy;

    @Transactional
    public Transaction createTransaction(TransactionRequest request) {
        validateHeader(request);

        UUID transactionId = UUID.randomUUID();
        Instant now = Instant.now();
        Instant occurredAt = request.getOccurredAt() != null ? request.getOccurredAt() : now;
        CurrencyCode currency = request.getCurrency() != null ? request.getCurrency() : CurrencyCode.USD;

        jdbcTemplate.update(
            "INSERT INTO transactions (id, occurred_at, description, direction, currency, created_by, period_id, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            transactionId,
            Timestamp.from(occurredAt),
            request.getDescription().trim(),
            request.getDirection().name(),
            currency.name(),
            request.getCreatedBy().trim(),
            request.getPeriodId(),
            Timestamp.from(now)
        );

        log.info("Created {} transaction {} by {}", request.getDirection(), transactionId, request.getCreatedBy());
        return new Transaction(transactionId, occurredAt, request.getDescription().trim(), request.getDirection(),
            currency, request.getCreatedBy().trim(), request.getPeriodId(), now);
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findById(UUID transactionId) {
        return jdbcTemplate.query(SELECT_TRANSACTION + "WHERE id = ?", transactionRowMapper(), transactionId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Transaction getTransaction(UUID transactionId) {
        return findById(transactionId).orElseThrow(() -> new NotFoundException("Transaction", transactionId));
    }

    @Transactional(readOnly = true)
    public List<Transaction> listTransactions(TransactionFilter filter) {
        StringBuilder sql = new StringBuilder(SELECT_TRANSACTION).append("WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (filter.getFrom() != null) {
            sql.append(" AND occurred_at >= ?");
            args.add(Timestamp.from(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            sql.append(" AND occurred_at < ?");
            args.add(Timestamp.from(filter.getTo()));
        }
        if (filter.getPeriodId() != null) {
            sql.append(" AND period_id = ?");
            args.add(filter.getPeriodId());
        }
        if (filter.getDirection() != null) {
            sql.append(" AND direction = ?");
            args.add(filter.getDirection().name());
        }
        sql.append(" ORDER BY occurred_at DESC, created_at DESC");

        return jdbcTemplate.query(sql.toString(), transactionRowMapper(), args.toArray());
    }

    /**
     * Replaces the header fields of a transaction. Entries are untouched.
     */
    @Transactional
    public Transaction updateTransaction(UUID transactionId, TransactionRequest request) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            lockForUpdate(transactionId);
            validateHeader(request);

            Transaction current = getTransaction(transactionId);
            Instant occurredAt = request.getOccurredAt() != null ? request.getOccurredAt() : current.getOccurredAt();
            CurrencyCode currency = request.getCurrency() != null ? request.getCurrency() : current.getCurrency();

            jdbcTemplate.update(
                "UPDATE transactions SET occurred_at = ?, description = ?, direction = ?, currency = ?, " +
                "created_by = ?, period_id = ? WHERE id = ?",
                Timestamp.from(occurredAt),
                request.getDescription().trim(),
                request.getDirection().name(),
                currency.name(),
                request.getCreatedBy().trim(),
                request.getPeriodId(),
                transactionId
            );

            log.info("Updated transaction header");
            return new Transaction(transactionId, occurredAt, request.getDescription().trim(), request.getDirection(),
                currency, request.getCreatedBy().trim(), request.getPeriodId(), current.getCreatedAt());
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Deletes a transaction using the configured default policy.
     */
    @Transactional
    public void deleteTransaction(UUID transactionId) {
        deleteTransaction(transactionId, defaultDeletionPolicy);
    }

    /**
     * Deletes a transaction. Under {@code REJECT_IF_ENTRIES} a transaction that
     * still owns entries is refused; under {@code CASCADE} its entries are
     * deleted first, in the same unit of work.
     *
     * @throws NotFoundException if the transaction does not exist
     * @throws ReferentialIntegrityException if entries exist under REJECT_IF_ENTRIES,
     *         or an invoice still references the transaction
     */
    @Transactional
    public void deleteTransaction(UUID transactionId, TransactionDeletionPolicy policy) {
        TransactionDeletionPolicy effective = policy != null ? policy : defaultDeletionPolicy;
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            lockForUpdate(transactionId);

            Integer entryCount = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM ledger_entries WHERE transaction_id = ?",
                Integer.class,
                transactionId
            );
            int entries = entryCount != null ? entryCount : 0;

            if (entries > 0) {
                if (effective == TransactionDeletionPolicy.REJECT_IF_ENTRIES) {
                    throw new ReferentialIntegrityException(
                        String.format("Transaction %s still has %d ledger entries", transactionId, entries));
                }
                jdbcTemplate.update("DELETE FROM ledger_entries WHERE transaction_id = ?", transactionId);
            }

            try {
                jdbcTemplate.update("DELETE FROM transactions WHERE id = ?", transactionId);
            } catch (DataIntegrityViolationException e) {
                throw new ReferentialIntegrityException(
                    "Transaction " + transactionId + " is referenced by an invoice and cannot be deleted", e);
            }

            ledgerMetrics.recordTransactionDeleted(effective.name());
            log.info("Deleted transaction with policy {} ({} entries removed)", effective,
                effective == TransactionDeletionPolicy.CASCADE ? entries : 0);
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Locks the transaction header row until the surrounding unit of work ends.
     * Must be called inside an existing transaction.
     *
     * @throws NotFoundException if the transaction does not exist
     * @throws ConcurrencyConflictException if the lock cannot be acquired
     */
    void lockForUpdate(UUID transactionId) {
        List<String> locked;
        try {
            locked = jdbcTemplate.queryForList(
                "SELECT id FROM transactions WHERE id = ? FOR UPDATE",
                String.class,
                transactionId
            );
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Could not lock transaction " + transactionId, e);
        }
        if (locked.isEmpty()) {
            throw new NotFoundException("Transaction", transactionId);
        }
    }

    private void validateHeader(TransactionRequest request) {
        if (request.getDescription() == null || request.getDescription().isBlank()) {
            throw new ConstraintViolationException("Transaction description is required");
        }
        if (request.getDirection() == null) {
            throw new ConstraintViolationException("Transaction direction is required");
        }
        if (request.getCreatedBy() == null || request.getCreatedBy().isBlank()) {
            throw new ConstraintViolationException("Transaction creator is required");
        }
        if (request.getPeriodId() != null && periodService.findById(request.getPeriodId()).isEmpty()) {
            throw new NotFoundException("Period", request.getPeriodId());
        }
    }

    private RowMapper<Transaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            String periodId = rs.getString("period_id");
            return new Transaction(
                UUID.fromString(rs.getString("id")),
                rs.getTimestamp("occurred_at").toInstant(),
                rs.getString("description"),
                Transaction.Direction.valueOf(rs.getString("direction")),
                CurrencyCode.valueOf(rs.getString("currency")),
                rs.getString("created_by"),
                periodId != null ? UUID.fromString(periodId) : null,
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
