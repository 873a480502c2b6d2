package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.common.Money;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the general ledger summary. Every account appears, with zero totals
 * when it has no movements in the requested date range. Balances here are
 * always debit minus credit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeneralLedgerService {

    static final int MIN_DIGITS = 1;
    static final int MAX_DIGITS = 10;

    private final JdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public GeneralLedger generate(int digits, LocalDate from, LocalDate to, boolean includeDetail) {
        if (digits < MIN_DIGITS || digits > MAX_DIGITS) {
            throw new ConstraintViolationException(
                String.format("Digits must be between %d and %d, got %d", MIN_DIGITS, MAX_DIGITS, digits));
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new ConstraintViolationException(
                String.format("Start date %s is after end date %s", from, to));
        }

        // Date bounds go into the join so accounts without movements still show up
        StringBuilder sql = new StringBuilder(
            "SELECT a.code, a.name, a.account_type, " +
            "       COALESCE(SUM(e.debit), 0) AS total_debit, " +
            "       COALESCE(SUM(e.credit), 0) AS total_credit " +
            "FROM accounts a " +
            "LEFT JOIN (SELECT le.account_id, le.debit, le.credit " +
            "           FROM ledger_entries le JOIN transactions t ON t.id = le.transaction_id " +
            "           WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (from != null) {
            sql.append(" AND t.occurred_at >= ?");
            args.add(Timestamp.from(from.atStartOfDay(ZoneOffset.UTC).toInstant()));
        }
        if (to != null) {
            sql.append(" AND t.occurred_at < ?");
            args.add(Timestamp.from(to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()));
        }
        sql.append(") e ON e.account_id = a.id " +
                   "GROUP BY a.code, a.name, a.account_type " +
                   "ORDER BY a.code");

        List<GeneralLedger.SubAccount> accounts = jdbcTemplate.query(sql.toString(), (rs, rowNum) -> {
            BigDecimal debit = Money.normalize(rs.getBigDecimal("total_debit"));
            BigDecimal credit = Money.normalize(rs.getBigDecimal("total_credit"));
            return new GeneralLedger.SubAccount(
                rs.getString("code"),
                rs.getString("name"),
                Account.AccountType.valueOf(rs.getString("account_type")),
                debit,
                credit,
                debit.subtract(credit)
            );
        }, args.toArray());

        Map<String, String> namesByCode = new TreeMap<>();
        for (GeneralLedger.SubAccount account : accounts) {
            namesByCode.put(account.getCode(), account.getName());
        }

        Map<String, List<GeneralLedger.SubAccount>> grouped = new TreeMap<>();
        for (GeneralLedger.SubAccount account : accounts) {
            grouped.computeIfAbsent(majorCode(account.getCode(), digits), k -> new ArrayList<>()).add(account);
        }

        List<GeneralLedger.MajorAccount> majors = new ArrayList<>();
        BigDecimal totalDebit = Money.ZERO;
        BigDecimal totalCredit = Money.ZERO;
        for (Map.Entry<String, List<GeneralLedger.SubAccount>> group : grouped.entrySet()) {
            BigDecimal debit = Money.ZERO;
            BigDecimal credit = Money.ZERO;
            for (GeneralLedger.SubAccount account : group.getValue()) {
                debit = debit.add(account.getTotalDebit());
                credit = credit.add(account.getTotalCredit());
            }
            totalDebit = totalDebit.add(debit);
            totalCredit = totalCredit.add(credit);

            String majorCode = group.getKey();
            String name = namesByCode.getOrDefault(majorCode, "Major account " + majorCode);
            majors.add(new GeneralLedger.MajorAccount(
                majorCode,
                name,
                debit,
                credit,
                debit.subtract(credit),
                includeDetail ? List.copyOf(group.getValue()) : List.of()
            ));
        }

        log.info("Generated general ledger: digits={}, from={}, to={}, majorAccounts={}",
            digits, from, to, majors.size());
        return new GeneralLedger(majors, totalDebit, totalCredit, totalDebit.subtract(totalCredit).abs(),
            digits, from, to);
    }

    /**
     * First {@code digits} characters of the code, right-padded with zeros when shorter.
     */
    static String majorCode(String code, int digits) {
        if (code.length() >= digits) {
            return code.substring(0, digits);
        }
        StringBuilder padded = new StringBuilder(code);
        while (padded.length() < digits) {
            padded.append('0');
        }
        return padded.toString();
    }
}
