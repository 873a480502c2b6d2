package com.flagship.ledger_invoicing.invoice;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Allocates invoice numbers of the form {@code PREFIX-YYYY-NNNN}, one
 * sequence per year.
 *
 * A transaction-scoped advisory lock serializes allocation per year, so a
 * second caller only reads the maximum after the first one has committed.
 * The unique constraint on the number remains the final guard.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoiceNumberGenerator {

    private final InvoiceRepository invoiceRepository;
    private final JdbcTemplate jdbcTemplate;

    @Value("${invoicing.number-prefix:FACT}")
    private String numberPrefix;

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextNumber(Instant issuedAt) {
        int year = issuedAt.atZone(ZoneOffset.UTC).getYear();
        String prefix = String.format("%s-%d-", numberPrefix, year);

        jdbcTemplate.queryForObject("SELECT 1 FROM pg_advisory_xact_lock(hashtext(?))", Integer.class, prefix);

        int next = invoiceRepository.findMaxSequence(prefix) + 1;
        String number = prefix + String.format("%04d", next);
        log.debug("Allocated invoice number {}", number);
        return number;
    }
}
