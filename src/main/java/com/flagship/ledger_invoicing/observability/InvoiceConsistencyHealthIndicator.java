package com.flagship.ledger_invoicing.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Reports invoices whose stored header totals differ from the sum of their
 * current lines. Any non-zero count means something wrote the header outside
 * the total maintainer.
 */
@Component("invoiceConsistency")
public class InvoiceConsistencyHealthIndicator implements HealthIndicator {

    static final String DRIFT_QUERY =
        "SELECT COUNT(*) FROM invoices i " +
        "LEFT JOIN (SELECT invoice_id, " +
        "                  SUM(line_subtotal) AS subtotal, " +
        "                  SUM(line_tax) AS tax, " +
        "                  SUM(line_total) AS total " +
        "           FROM invoice_lines GROUP BY invoice_id) l ON l.invoice_id = i.id " +
        "WHERE i.subtotal <> COALESCE(l.subtotal, 0) " +
        "   OR i.tax <> COALESCE(l.tax, 0) " +
        "   OR i.grand_total <> COALESCE(l.total, 0)";

    private final JdbcTemplate jdbcTemplate;

    public InvoiceConsistencyHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        try {
            Long drifted = jdbcTemplate.queryForObject(DRIFT_QUERY, Long.class);
            long count = drifted != null ? drifted : 0L;

            Health.Builder builder = count == 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("invoicesWithDriftedTotals", count)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
