package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of accounting periods. New periods start OPEN.
 */
@Service
@Slf4j
public class PeriodService {

    private static final String SELECT_PERIOD =
        "SELECT id, start_date, end_date, period_type, status FROM periods ";

    private final JdbcTemplate jdbcTemplate;

    public PeriodService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public Period createPeriod(LocalDate startDate, LocalDate endDate, Period.PeriodType periodType) {
        if (startDate == null || endDate == null) {
            throw new ConstraintViolationException("Period start and end dates are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new ConstraintViolationException(
                String.format("Period start date %s is after end date %s", startDate, endDate));
        }
        if (periodType == null) {
            throw new ConstraintViolationException("Period type is required");
        }

        UUID periodId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO periods (id, start_date, end_date, period_type, status) VALUES (?, ?, ?, ?, ?)",
            periodId,
            startDate,
            endDate,
            periodType.name(),
            Period.Status.OPEN.name()
        );

        log.info("Created {} period {} .. {} ({})", periodType, startDate, endDate, periodId);
        return new Period(periodId, startDate, endDate, periodType, Period.Status.OPEN);
    }

    @Transactional(readOnly = true)
    public Optional<Period> findById(UUID periodId) {
        return jdbcTemplate.query(SELECT_PERIOD + "WHERE id = ?", periodRowMapper(), periodId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Period getPeriod(UUID periodId) {
        return findById(periodId).orElseThrow(() -> new NotFoundException("Period", periodId));
    }

    @Transactional(readOnly = true)
    public List<Period> listPeriods() {
        return jdbcTemplate.query(SELECT_PERIOD + "ORDER BY start_date DESC", periodRowMapper());
    }

    private RowMapper<Period> periodRowMapper() {
        return (rs, rowNum) -> new Period(
            UUID.fromString(rs.getString("id")),
            rs.getObject("start_date", LocalDate.class),
            rs.getObject("end_date", LocalDate.class),
            Period.PeriodType.valueOf(rs.getString("period_type")),
            Period.Status.valueOf(rs.getString("status"))
        );
    }
}
