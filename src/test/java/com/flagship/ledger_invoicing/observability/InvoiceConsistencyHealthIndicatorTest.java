package com.flagship.ledger_invoicing.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InvoiceConsistencyHealthIndicatorTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final InvoiceConsistencyHealthIndicator indicator = new InvoiceConsistencyHealthIndicator(jdbcTemplate);

    @Test
    @DisplayName("No drifted invoices reports UP")
    void testConsistent_Up() {
        when(jdbcTemplate.queryForObject(InvoiceConsistencyHealthIndicator.DRIFT_QUERY, Long.class)).thenReturn(0L);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(0L, health.getDetails().get("invoicesWithDriftedTotals"));
    }

    @Test
    @DisplayName("Drifted invoices report DOWN with the count")
    void testDrift_Down() {
        when(jdbcTemplate.queryForObject(InvoiceConsistencyHealthIndicator.DRIFT_QUERY, Long.class)).thenReturn(3L);

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(3L, health.getDetails().get("invoicesWithDriftedTotals"));
    }

    @Test
    @DisplayName("A failing query reports DOWN with the error")
    void testQueryFailure_Down() {
        when(jdbcTemplate.queryForObject(InvoiceConsistencyHealthIndicator.DRIFT_QUERY, Long.class))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("connection refused", health.getDetails().get("error"));
    }
}
